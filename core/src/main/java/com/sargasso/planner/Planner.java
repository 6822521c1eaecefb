package com.sargasso.planner;

import com.sargasso.algebra.AnsiJoin;
import com.sargasso.algebra.FromTerm;
import com.sargasso.algebra.KeyspaceTerm;
import com.sargasso.algebra.SelectStatement;
import com.sargasso.algebra.SimpleTerm;
import com.sargasso.algebra.Unnest;
import com.sargasso.catalog.Catalog;
import com.sargasso.cost.CostOracle;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Identifier;
import com.sargasso.plan.EmptyResult;
import com.sargasso.plan.FilterOperator;
import com.sargasso.plan.LimitOperator;
import com.sargasso.plan.PlanOperator;
import com.sargasso.plan.UnnestOperator;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.classify.ExprClassifier;
import com.sargasso.planner.join.BuilderState;
import com.sargasso.planner.join.JoinCandidate;
import com.sargasso.planner.join.JoinStrategy;
import com.sargasso.planner.join.JoinStrategySelector;
import com.sargasso.planner.nullrej.OuterToInnerRewriter;
import com.sargasso.planner.scan.ScanBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans SELECT statements.
 *
 * <p>Planning a statement:
 * <ol>
 *   <li>registers every FROM term, with outer joins and outer unnests one outer level deep</li>
 *   <li>classifies the WHERE clause and the ON clauses of inner joins</li>
 *   <li>turns outer joins whose right side is null-rejected into inner joins</li>
 *   <li>scans the first term, then adds each join, nest and unnest in FROM order,
 *       classifying the ON clause of a remaining outer join once its left side is planned</li>
 *   <li>applies the WHERE clause and then OFFSET and LIMIT</li>
 * </ol>
 *
 * <p>Planner instances hold no per-statement state and may be shared.
 */
public final class Planner {

    private static final Logger logger = LoggerFactory.getLogger(Planner.class);

    private final Catalog catalog;
    private final CostOracle costOracle;
    private final PlannerConfig config;

    /**
     * Creates a rule-based planner with settings from system properties.
     *
     * @param catalog the catalog
     */
    public Planner(Catalog catalog) {
        this(catalog, null, PlannerConfig.fromSystemProperties());
    }

    /**
     * Creates a planner.
     *
     * @param catalog the catalog
     * @param costOracle the cost oracle, or null for rule-based planning
     * @param config the settings
     */
    public Planner(Catalog catalog, CostOracle costOracle, PlannerConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.costOracle = costOracle;
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Plans a statement.
     *
     * @param statement the statement
     * @return the plan
     * @throws com.sargasso.exception.PlanningException if no plan is possible
     */
    public QueryPlan plan(SelectStatement statement) {
        PlanContext context = new PlanContext(catalog, costOracle, config);
        List<FromTerm> terms = flatten(statement.from());
        FilterRegistry registry = register(terms);
        Map<String, JoinStrategy> strategies = new LinkedHashMap<>();

        if (statement.where() != null) {
            Optional<Boolean> constant = new ExprClassifier(registry, context, false).classify(statement.where());
            if (constant.isPresent() && !constant.get()) {
                return empty(registry, context, strategies, "WHERE clause is always false");
            }
        }
        for (FromTerm term : terms) {
            if (term instanceof AnsiJoin && !((AnsiJoin) term).isOuter()) {
                Optional<Boolean> constant = new ExprClassifier(registry, context, false)
                    .classify(((AnsiJoin) term).onclause());
                if (constant.isPresent() && !constant.get()) {
                    return empty(registry, context, strategies, "ON clause of an inner join is always false");
                }
            }
        }

        new OuterToInnerRewriter(registry, context).rewrite(statement.from());

        ScanBuilder scanBuilder = new ScanBuilder(registry, context, statementExpressions(statement, terms));
        JoinStrategySelector selector = new JoinStrategySelector(registry, context, scanBuilder,
            statement.isFirstRowsOnly());

        BuilderState state = null;
        for (FromTerm term : terms) {
            BaseKeyspace keyspace = registry.get(term.alias());
            if (term instanceof SimpleTerm) {
                state = BuilderState.start(scanBuilder.build(keyspace, (SimpleTerm) term, ScanBuilder.Mode.STANDALONE));
            } else if (term instanceof Unnest) {
                Unnest unnest = (Unnest) term;
                UnnestOperator op = new UnnestOperator(state.root(), unnest.alias(), unnest.expression(),
                    unnest.isOuter());
                op.setCost(state.root().cost());
                state = state.push(op, null);
            } else {
                AnsiJoin join = (AnsiJoin) term;
                if (join.isOuter()) {
                    new ExprClassifier(registry, context, true).classify(join.onclause());
                }
                JoinCandidate candidate = selector.build(join, state);
                strategies.put(join.alias(), candidate.strategy());
                state = candidate.state();
            }
            keyspace.setFlag(BaseKeyspace.Flag.PLAN_DONE);
            registry.moveJoinFilters(keyspace.alias());
        }

        if (statement.where() != null) {
            state = state.withPendingFilter(statement.where());
        }
        PlanOperator root = finish(state, statement);
        logger.debug("Plan for {}:\n{}", statement, root.explain());
        return new QueryPlan(root, registry, context.hints().warnings(), strategies);
    }

    private static QueryPlan empty(FilterRegistry registry, PlanContext context,
                                   Map<String, JoinStrategy> strategies, String reason) {
        logger.debug("Empty result: {}", reason);
        return new QueryPlan(new EmptyResult(), registry, context.hints().warnings(), strategies);
    }

    private static PlanOperator finish(BuilderState state, SelectStatement statement) {
        PlanOperator root = state.root();
        if (state.pendingFilter() != null) {
            PlanOperator filter = new FilterOperator(root, state.pendingFilter());
            filter.setCost(root.cost());
            root = filter;
        }
        if (statement.limit() != null || statement.offset() != null) {
            PlanOperator limit = new LimitOperator(root, statement.limit(), statement.offset());
            limit.setCost(root.cost());
            root = limit;
        }
        return root;
    }

    // ==================== Registration ====================

    /**
     * Lists the nodes of a left-deep FROM tree, first term first.
     */
    static List<FromTerm> flatten(FromTerm from) {
        LinkedList<FromTerm> terms = new LinkedList<>();
        FromTerm current = from;
        while (true) {
            terms.addFirst(current);
            if (current instanceof AnsiJoin) {
                current = ((AnsiJoin) current).left();
            } else if (current instanceof Unnest) {
                current = ((Unnest) current).left();
            } else {
                return terms;
            }
        }
    }

    private static FilterRegistry register(List<FromTerm> terms) {
        FilterRegistry registry = new FilterRegistry();
        String primaryAlias = terms.get(0).alias();
        for (FromTerm term : terms) {
            BaseKeyspace keyspace;
            if (term instanceof SimpleTerm) {
                keyspace = new BaseKeyspace(term.alias(), path((SimpleTerm) term), null, 0);
                keyspace.setFlag(BaseKeyspace.Flag.PRIMARY_TERM);
            } else if (term instanceof Unnest) {
                Unnest unnest = (Unnest) term;
                keyspace = new BaseKeyspace(unnest.alias(), null, unnest.expression(), unnest.isOuter() ? 1 : 0);
                if (!unnest.isOuter() && Expressions.references(unnest.expression(), primaryAlias)) {
                    keyspace.setFlag(BaseKeyspace.Flag.PRIMARY_UNNEST);
                }
            } else {
                AnsiJoin join = (AnsiJoin) term;
                keyspace = new BaseKeyspace(join.alias(), path(join.right()), null, join.isOuter() ? 1 : 0);
            }
            registry.add(keyspace);
        }
        return registry;
    }

    private static String path(SimpleTerm term) {
        return term instanceof KeyspaceTerm ? ((KeyspaceTerm) term).path() : null;
    }

    /**
     * Collects the expressions that read documents, for covering decisions.
     * SELECT * reads every document whole.
     */
    private static List<Expression> statementExpressions(SelectStatement statement, List<FromTerm> terms) {
        List<Expression> exprs = new ArrayList<>();
        if (statement.where() != null) {
            exprs.add(statement.where());
        }
        if (statement.projection().isEmpty()) {
            for (FromTerm term : terms) {
                exprs.add(new Identifier(term.alias()));
            }
        } else {
            exprs.addAll(statement.projection());
        }
        for (FromTerm term : terms) {
            if (term instanceof AnsiJoin) {
                exprs.add(((AnsiJoin) term).onclause());
            } else if (term instanceof Unnest) {
                exprs.add(((Unnest) term).expression());
            }
        }
        return exprs;
    }
}
