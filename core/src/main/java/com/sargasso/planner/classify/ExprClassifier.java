package com.sargasso.planner.classify;

import com.sargasso.cost.Cost;
import com.sargasso.cost.CostOracle;
import com.sargasso.expression.And;
import com.sargasso.expression.Arithmetic;
import com.sargasso.expression.ArrayConstruct;
import com.sargasso.expression.Between;
import com.sargasso.expression.CaseWhen;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Element;
import com.sargasso.expression.Expression;
import com.sargasso.expression.ExpressionVisitor;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Field;
import com.sargasso.expression.FunctionCall;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.In;
import com.sargasso.expression.IsExpression;
import com.sargasso.expression.Like;
import com.sargasso.expression.Literal;
import com.sargasso.expression.Meta;
import com.sargasso.expression.Normalizer;
import com.sargasso.expression.Not;
import com.sargasso.expression.ObjectConstruct;
import com.sargasso.expression.Or;
import com.sargasso.expression.Parameter;
import com.sargasso.expression.Quantified;
import com.sargasso.expression.Subquery;
import com.sargasso.expression.Within;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decomposes a boolean expression into per-keyspace filters.
 *
 * <p>Conjunctions are flattened and each conjunct becomes one {@link Filter}:
 * attached to its keyspace when it refers to one alias, or to the join filters
 * of every referenced alias when it refers to several. Conjuncts that refer to
 * no alias are dropped; they have the same value for every row.
 *
 * <p>A disjunction is classified as one unit after pruning branches that are
 * statically FALSE, NULL or MISSING. A statically TRUE branch makes the whole
 * disjunction TRUE. When a disjunctive join filter restricts some keyspace in
 * every branch, an extra derived single-keyspace filter is synthesized so that
 * keyspace can use an index union scan.
 *
 * <p>{@link #classify(Expression)} returns a value only when the entire
 * expression is a known constant.
 */
public final class ExprClassifier implements ExpressionVisitor<Optional<Boolean>> {

    private static final Logger logger = LoggerFactory.getLogger(ExprClassifier.class);

    private final FilterRegistry registry;
    private final PlanContext context;
    private final boolean onclause;
    private final boolean deriveFilters;
    private Expression pendingOrigExpr;

    /**
     * Creates a classifier.
     *
     * @param registry the registry receiving the filters
     * @param context the planning context
     * @param onclause whether the classified expressions come from an ON clause
     */
    public ExprClassifier(FilterRegistry registry, PlanContext context, boolean onclause) {
        this(registry, context, onclause, true);
    }

    private ExprClassifier(FilterRegistry registry, PlanContext context, boolean onclause, boolean deriveFilters) {
        this.registry = registry;
        this.context = context;
        this.onclause = onclause;
        this.deriveFilters = deriveFilters;
    }

    /**
     * Classifies an expression into the registry.
     *
     * @param expr the boolean expression
     * @return the truth value if the whole expression is constant, otherwise empty
     */
    public Optional<Boolean> classify(Expression expr) {
        Optional<Boolean> result = expr.accept(this);
        logger.debug("Classified {} (onclause={}): constant={}", expr, onclause, result);
        return result;
    }

    // ==================== Connectives ====================

    @Override
    public Optional<Boolean> visitAnd(And expr) {
        boolean allTrue = true;
        for (Expression conjunct : Expressions.flattenAnd(expr)) {
            Optional<Boolean> result = conjunct.accept(this);
            if (result.isPresent() && !result.get()) {
                return Optional.of(false);
            }
            allTrue &= result.isPresent();
        }
        return allTrue ? Optional.of(true) : Optional.empty();
    }

    @Override
    public Optional<Boolean> visitOr(Or expr) {
        List<Expression> kept = new ArrayList<>();
        for (Expression disjunct : Expressions.flattenOr(expr)) {
            Optional<Value> constant = Expressions.staticValue(disjunct);
            if (constant.isPresent()) {
                if (constant.get().truth()) {
                    return Optional.of(true);
                }
                // FALSE, NULL, MISSING and non-boolean constants never select a row
                continue;
            }
            kept.add(disjunct);
        }
        if (kept.isEmpty()) {
            return Optional.of(false);
        }
        if (kept.size() == 1) {
            return kept.get(0).accept(this);
        }
        return classifyFragment(new Or(kept));
    }

    // ==================== Fragments ====================

    private Optional<Boolean> classifyFragment(Expression expr) {
        Optional<Value> constant = Expressions.staticValue(expr);
        if (constant.isPresent()) {
            return Optional.of(constant.get().truth());
        }

        Set<String> allRefs = Expressions.referencedAliases(expr, registry.aliases());
        Set<String> refs = new LinkedHashSet<>(allRefs);
        if (onclause) {
            refs.removeAll(registry.plannedAliases());
        }
        if (refs.isEmpty()) {
            return Optional.empty();
        }

        Expression normalized = Normalizer.nnf(expr);
        if (normalized instanceof And) {
            // the first filter of the revealed conjunction keeps the expression as written
            if (pendingOrigExpr == null) {
                pendingOrigExpr = expr;
            }
            try {
                return normalized.accept(this);
            } finally {
                pendingOrigExpr = null;
            }
        }
        if (normalized instanceof Literal) {
            return Optional.of(((Literal) normalized).value().truth());
        }

        Expression origExpr = pendingOrigExpr != null ? pendingOrigExpr : expr;
        pendingOrigExpr = null;
        // a fragment naming a planned alias still depends on the other side of the join
        Filter filter = new Filter(normalized, origExpr, refs, onclause, allRefs.size() > 1);
        if (Expressions.containsSubquery(normalized)) {
            filter.setFlag(Filter.Flag.HAS_SUBQUERY);
        }

        if (refs.size() == 1) {
            BaseKeyspace keyspace = registry.get(refs.iterator().next());
            if (keyspace.isUnnest()) {
                filter.setFlag(Filter.Flag.UNNEST);
            }
            estimateSelectivity(filter, keyspace);
            keyspace.addFilter(filter);
        } else {
            registry.attach(filter);
            if (deriveFilters && normalized instanceof Or) {
                deriveOrFilters((Or) normalized, refs);
            }
        }
        return Optional.empty();
    }

    /**
     * Synthesizes single-keyspace filters from a disjunctive join filter.
     *
     * <p>Each disjunct is classified against a scratch registry. If every disjunct
     * restricts a given keyspace, the conjunction of those restrictions per
     * disjunct, OR-ed together, is implied by the join filter and becomes a
     * derived filter of that keyspace.
     */
    private void deriveOrFilters(Or or, Set<String> refs) {
        List<FilterRegistry> scratches = new ArrayList<>();
        for (Expression disjunct : or.operands()) {
            FilterRegistry scratch = registry.copy(false);
            Optional<Boolean> constant = new ExprClassifier(scratch, context, onclause, false).classify(disjunct);
            if (constant.isPresent()) {
                if (constant.get()) {
                    return;
                }
                continue;
            }
            scratches.add(scratch);
        }
        if (scratches.isEmpty()) {
            return;
        }
        for (String alias : refs) {
            List<Expression> parts = new ArrayList<>();
            for (FilterRegistry scratch : scratches) {
                List<Expression> conjuncts = new ArrayList<>();
                for (Filter filter : scratch.get(alias).filters()) {
                    conjuncts.add(filter.fltrExpr());
                }
                if (conjuncts.isEmpty()) {
                    parts = null;
                    break;
                }
                parts.add(Expressions.and(conjuncts));
            }
            if (parts == null) {
                continue;
            }
            Expression derivedExpr = Expressions.or(parts);
            Set<String> keyspaces = new LinkedHashSet<>();
            keyspaces.add(alias);
            Filter derived = new Filter(derivedExpr, derivedExpr, keyspaces, onclause, false);
            derived.setFlag(Filter.Flag.DERIVED);
            BaseKeyspace keyspace = registry.get(alias);
            estimateSelectivity(derived, keyspace);
            keyspace.addFilter(derived);
            logger.debug("Derived filter {} for keyspace {} from join filter {}", derivedExpr, alias, or);
        }
    }

    private void estimateSelectivity(Filter filter, BaseKeyspace keyspace) {
        if (!context.config().selectivityEnabled() || keyspace.isUnnest()) {
            return;
        }
        Optional<CostOracle> oracle = context.costOracle();
        if (oracle.isEmpty()) {
            return;
        }
        OptionalLong count = keyspace.documentCount(context.catalog());
        if (count.isEmpty()) {
            return;
        }
        double selectivity = oracle.get().selectivity(filter.fltrExpr(), keyspace.alias(), count.getAsLong());
        if (selectivity != Cost.SELEC_NOT_AVAILABLE) {
            filter.setSelectivity(selectivity);
            filter.setFlag(Filter.Flag.SELEC_DONE);
        }
    }

    // ==================== Leaves ====================

    @Override
    public Optional<Boolean> visitLiteral(Literal expr) {
        return Optional.of(expr.value().truth());
    }

    @Override
    public Optional<Boolean> visitIdentifier(Identifier expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitParameter(Parameter expr) {
        return Optional.empty();
    }

    @Override
    public Optional<Boolean> visitField(Field expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitElement(Element expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitMeta(Meta expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitComparison(Comparison expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitArithmetic(Arithmetic expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitNot(Not expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitBetween(Between expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitLike(Like expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitIn(In expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitWithin(Within expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitIs(IsExpression expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitQuantified(Quantified expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitCaseWhen(CaseWhen expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitArrayConstruct(ArrayConstruct expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitObjectConstruct(ObjectConstruct expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitFunctionCall(FunctionCall expr) {
        return classifyFragment(expr);
    }

    @Override
    public Optional<Boolean> visitSubquery(Subquery expr) {
        return classifyFragment(expr);
    }
}
