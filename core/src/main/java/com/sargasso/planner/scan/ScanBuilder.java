package com.sargasso.planner.scan;

import com.sargasso.algebra.ExpressionTerm;
import com.sargasso.algebra.KeyspaceTerm;
import com.sargasso.algebra.SimpleTerm;
import com.sargasso.algebra.SubqueryTerm;
import com.sargasso.catalog.Index;
import com.sargasso.catalog.IndexKey;
import com.sargasso.catalog.Keyspace;
import com.sargasso.cost.Cost;
import com.sargasso.cost.CostOracle;
import com.sargasso.exception.NoAccessPathException;
import com.sargasso.exception.PlanErrorCode;
import com.sargasso.exception.PlanningException;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Element;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Field;
import com.sargasso.expression.Formalizer;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.Implication;
import com.sargasso.expression.In;
import com.sargasso.expression.Meta;
import com.sargasso.expression.Or;
import com.sargasso.plan.ExpressionScan;
import com.sargasso.plan.Fetch;
import com.sargasso.plan.IndexScan;
import com.sargasso.plan.IntersectScan;
import com.sargasso.plan.KeyScan;
import com.sargasso.plan.PlanOperator;
import com.sargasso.plan.PrimaryScan;
import com.sargasso.plan.UnionScan;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.sarg.IndexEntry;
import com.sargasso.planner.sarg.IntersectSpans;
import com.sargasso.planner.sarg.KeySarger;
import com.sargasso.planner.sarg.MinimalIndexes;
import com.sargasso.planner.sarg.SargBuilder;
import com.sargasso.planner.sarg.SargSpans;
import com.sargasso.planner.sarg.SargableChecker;
import com.sargasso.planner.sarg.UnionSpans;
import com.sargasso.value.ValueType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the access path of one FROM term.
 *
 * <p>For a keyspace, in order of preference:
 * <ol>
 *   <li>{@code USE KEYS}, or an equality or IN on {@code META(alias).id}: a key scan</li>
 *   <li>secondary indexes whose leading key the predicate constrains: the cheapest
 *       one with a cost oracle, otherwise an intersect scan over all of them</li>
 *   <li>an OR predicate that no single index answers: a union scan of per-branch scans</li>
 *   <li>the primary index, except on the inner side of a nested-loop join</li>
 * </ol>
 * Every scan except a covering index scan is followed by a fetch.
 */
public final class ScanBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ScanBuilder.class);

    /**
     * How the scanned term is joined.
     */
    public enum Mode {
        /** The first term of the FROM clause. */
        STANDALONE,
        /** The inner side of a nested-loop join; bounds may use outer values. */
        NESTED_LOOP,
        /** One side of a hash join, built without the other side's values. */
        HASH
    }

    private final FilterRegistry registry;
    private final PlanContext context;
    private final Collection<Expression> statementExprs;
    private final Map<String, List<Index>> indexCache = new HashMap<>();

    /**
     * Creates a scan builder for one statement.
     *
     * @param registry the statement's filter registry
     * @param context the planning context
     * @param statementExprs every expression of the statement, to decide index coverage
     */
    public ScanBuilder(FilterRegistry registry, PlanContext context, Collection<Expression> statementExprs) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.statementExprs = List.copyOf(statementExprs);
    }

    /**
     * Builds the scan of a simple FROM term.
     *
     * @param keyspace the term's registry entry
     * @param term the term
     * @param mode how the term is joined
     * @return the scan, including the fetch when one is needed
     * @throws NoAccessPathException if no access path is allowed in this mode
     */
    public PlanOperator build(BaseKeyspace keyspace, SimpleTerm term, Mode mode) {
        if (term instanceof ExpressionTerm) {
            ExpressionTerm expressionTerm = (ExpressionTerm) term;
            boolean correlated = Expressions.references(expressionTerm.expression(), registry.plannedAliases());
            return new ExpressionScan(term.alias(), expressionTerm.expression(), correlated);
        }
        if (term instanceof SubqueryTerm) {
            SubqueryTerm subqueryTerm = (SubqueryTerm) term;
            return new ExpressionScan(term.alias(), subqueryTerm.subquery(), subqueryTerm.isCorrelated());
        }
        return buildKeyspaceScan(keyspace, (KeyspaceTerm) term, mode);
    }

    private PlanOperator buildKeyspaceScan(BaseKeyspace keyspace, KeyspaceTerm term, Mode mode) {
        String alias = keyspace.alias();
        List<Index> indexes = indexes(term);
        registry.combineFilters(keyspace, mode == Mode.HASH, context.config().maxDnfComplexity());
        Expression pred = keyspace.dnfPred();
        boolean join = mode == Mode.NESTED_LOOP;

        if (term.useKeys() != null) {
            return keyScan(keyspace, term.useKeys());
        }

        if (pred != null) {
            Expression keys = documentKeys(pred, alias, join);
            if (keys != null) {
                return keyScan(keyspace, keys);
            }

            List<IndexEntry> entries = candidates(keyspace, term, indexes, pred, join);
            if (!entries.isEmpty()) {
                PlanOperator scan = chooseScan(keyspace, entries);
                markSargedFilters(keyspace, entries, join);
                return scan;
            }

            if (pred instanceof Or) {
                PlanOperator union = unionScan(keyspace, term, indexes, (Or) pred, join);
                if (union != null) {
                    markAllFilters(keyspace);
                    return union;
                }
            }
        }

        if (join) {
            throw new NoAccessPathException(PlanErrorCode.NO_ACCESS_PATH,
                "No index can use the join predicate of the inner keyspace", alias);
        }
        for (Index index : indexes) {
            if (index.isPrimary() && index.isOnline()) {
                logger.debug("Using primary index {} for {}", index.name(), alias);
                PrimaryScan scan = new PrimaryScan(alias, index);
                scan.setCost(indexCost(keyspace, index, 1.0));
                return fetch(alias, scan);
            }
        }
        throw new NoAccessPathException(PlanErrorCode.NO_ACCESS_PATH,
            "No index available on keyspace " + term.path(), alias);
    }

    private List<Index> indexes(KeyspaceTerm term) {
        return indexCache.computeIfAbsent(term.path(), path -> {
            Keyspace keyspace = context.catalog().keyspace(path)
                .orElseThrow(() -> new PlanningException(PlanErrorCode.UNKNOWN_KEYSPACE,
                    "Keyspace not found: " + path, term.alias()));
            List<Index> sorted = new ArrayList<>(keyspace.indexes());
            sorted.sort(Comparator.comparing(Index::name));
            return sorted;
        });
    }

    // ==================== Key scans ====================

    /**
     * Finds a conjunct {@code META(alias).id = v} or {@code META(alias).id IN v}
     * whose right side can be evaluated before the scan.
     */
    private Expression documentKeys(Expression pred, String alias, boolean join) {
        for (Expression conjunct : Expressions.flattenAnd(pred)) {
            if (conjunct instanceof Comparison && ((Comparison) conjunct).operator() == Comparison.Operator.EQ) {
                Comparison eq = (Comparison) conjunct;
                if (Expressions.isDocumentKey(eq.left(), alias) && isKeyValue(eq.right(), alias, join)) {
                    return eq.right();
                }
                if (Expressions.isDocumentKey(eq.right(), alias) && isKeyValue(eq.left(), alias, join)) {
                    return eq.left();
                }
            } else if (conjunct instanceof In) {
                In in = (In) conjunct;
                if (Expressions.isDocumentKey(in.operand(), alias) && isKeyValue(in.collection(), alias, join)) {
                    return in.collection();
                }
            }
        }
        return null;
    }

    private static boolean isKeyValue(Expression expr, String alias, boolean join) {
        if (Expressions.containsSubquery(expr)) {
            return false;
        }
        return join ? !Expressions.references(expr, alias) : Expressions.isStatic(expr);
    }

    private PlanOperator keyScan(BaseKeyspace keyspace, Expression keys) {
        KeyScan scan = new KeyScan(keyspace.alias(), keys);
        context.costOracle().ifPresent(oracle -> {
            double count = Expressions.staticValue(keys)
                .filter(value -> value.type() == ValueType.ARRAY)
                .map(value -> (double) value.elements().size())
                .orElse(1.0);
            scan.setCost(oracle.keyScanCost(keyspace.alias(), count));
        });
        logger.debug("Using key scan on {} for {}", keys, keyspace.alias());
        return fetch(keyspace.alias(), scan);
    }

    // ==================== Index candidates ====================

    private List<IndexEntry> candidates(BaseKeyspace keyspace, KeyspaceTerm term, List<Index> indexes,
                                        Expression pred, boolean join) {
        String alias = keyspace.alias();
        int fanout = context.config().spanFanout();
        List<IndexEntry> entries = new ArrayList<>();
        for (Index index : hinted(keyspace, term, indexes)) {
            if (index.isPrimary() || !index.isOnline()) {
                continue;
            }
            if (index.condition() != null
                    && !Implication.implies(pred, Formalizer.formalize(index.condition(), alias))) {
                continue;
            }
            List<IndexKey> keys = formalize(index, alias);
            int sargKeys = SargableChecker.sargableKeys(pred, keys, alias, join, fanout);
            if (sargKeys == 0) {
                continue;
            }
            SargSpans spans = SargBuilder.sargFor(pred, keys, sargKeys, alias, join, fanout);
            entries.add(new IndexEntry(index, keys, sargKeys, spans));
        }
        List<IndexEntry> pruned = MinimalIndexes.prune(entries);
        logger.debug("Index candidates for {}: {}", alias, pruned);
        return pruned;
    }

    /**
     * Restricts indexes to a USE INDEX hint. Unknown names and a hint that
     * leaves nothing usable are reported and ignored.
     */
    private List<Index> hinted(BaseKeyspace keyspace, KeyspaceTerm term, List<Index> indexes) {
        if (term.indexHints().isEmpty()) {
            return indexes;
        }
        List<Index> result = new ArrayList<>();
        for (String name : term.indexHints()) {
            Index found = null;
            for (Index index : indexes) {
                if (index.name().equals(name)) {
                    found = index;
                    break;
                }
            }
            if (found == null) {
                context.hints().warn(keyspace.alias(), "USE INDEX (" + name + ")", "index not found");
            } else if (!found.isOnline()) {
                context.hints().warn(keyspace.alias(), "USE INDEX (" + name + ")", "index is not online");
            } else {
                result.add(found);
            }
        }
        if (result.isEmpty()) {
            return indexes;
        }
        return result;
    }

    private static List<IndexKey> formalize(Index index, String alias) {
        List<IndexKey> keys = new ArrayList<>(index.keys().size());
        for (IndexKey key : index.keys()) {
            keys.add(key.formalize(alias));
        }
        return keys;
    }

    private PlanOperator chooseScan(BaseKeyspace keyspace, List<IndexEntry> entries) {
        String alias = keyspace.alias();
        if (context.isCostBased()) {
            IndexEntry best = null;
            for (IndexEntry entry : entries) {
                entry.setCost(indexCost(keyspace, entry.index(), entry.selectivity()));
                if (entry.cost().isAvailable() && (best == null || entry.cost().cost() < best.cost().cost())) {
                    best = entry;
                }
            }
            if (best != null) {
                logger.debug("Cheapest index for {}: {} at {}", alias, best.name(), best.cost());
                PlanOperator scan = indexScan(keyspace, best);
                scan.setCost(best.cost());
                return fetchUnlessCovered(alias, scan);
            }
        }
        if (entries.size() == 1) {
            return fetchUnlessCovered(alias, indexScan(keyspace, entries.get(0)));
        }
        List<PlanOperator> scans = new ArrayList<>();
        for (IndexEntry entry : entries) {
            scans.add(indexScan(keyspace, entry));
        }
        return fetch(alias, new IntersectScan(scans));
    }

    private PlanOperator unionScan(BaseKeyspace keyspace, KeyspaceTerm term, List<Index> indexes,
                                   Or pred, boolean join) {
        List<PlanOperator> scans = new ArrayList<>();
        for (Expression disjunct : Expressions.flattenOr(pred)) {
            List<IndexEntry> entries = candidates(keyspace, term, indexes, disjunct, join);
            if (entries.isEmpty()) {
                logger.debug("No index for branch {} of {}", disjunct, keyspace.alias());
                return null;
            }
            IndexEntry entry = entries.get(0);
            if (context.isCostBased()) {
                for (IndexEntry candidate : entries) {
                    candidate.setCost(indexCost(keyspace, candidate.index(), candidate.selectivity()));
                    if (candidate.cost().isAvailable()
                            && (!entry.cost().isAvailable() || candidate.cost().cost() < entry.cost().cost())) {
                        entry = candidate;
                    }
                }
            }
            scans.add(indexScan(keyspace, entry));
        }
        return fetch(keyspace.alias(), scans.size() == 1 ? scans.get(0) : new UnionScan(scans));
    }

    private Cost indexCost(BaseKeyspace keyspace, Index index, double selectivity) {
        if (context.costOracle().isEmpty()) {
            return Cost.NOT_AVAILABLE;
        }
        CostOracle oracle = context.costOracle().get();
        OptionalLong count = keyspace.documentCount(context.catalog());
        return oracle.indexScanCost(index, keyspace.alias(), selectivity, count.orElse(-1L));
    }

    // ==================== Scan operators ====================

    private PlanOperator indexScan(BaseKeyspace keyspace, IndexEntry entry) {
        return realize(keyspace, entry, entry.spans());
    }

    private PlanOperator realize(BaseKeyspace keyspace, IndexEntry entry, SargSpans spans) {
        if (spans instanceof IntersectSpans) {
            List<PlanOperator> scans = new ArrayList<>();
            for (SargSpans child : ((IntersectSpans) spans).children()) {
                scans.add(realize(keyspace, entry, child));
            }
            return new IntersectScan(scans);
        }
        if (spans instanceof UnionSpans) {
            List<PlanOperator> scans = new ArrayList<>();
            for (SargSpans child : ((UnionSpans) spans).children()) {
                scans.add(realize(keyspace, entry, child));
            }
            return new UnionScan(scans);
        }
        boolean covering = isCovering(keyspace.alias(), entry);
        if (covering) {
            entry.setFlag(IndexEntry.Flag.COVERING);
        }
        return new IndexScan(keyspace.alias(), entry.index(), spans, covering);
    }

    private static PlanOperator fetchUnlessCovered(String alias, PlanOperator scan) {
        if (scan instanceof IndexScan && ((IndexScan) scan).isCovering()) {
            return scan;
        }
        return fetch(alias, scan);
    }

    private static PlanOperator fetch(String alias, PlanOperator scan) {
        Fetch fetch = new Fetch(alias, scan);
        fetch.setCost(scan.cost());
        return fetch;
    }

    // ==================== Covering ====================

    /**
     * An index covers the statement when every reference to the alias is a key
     * of the index or the document key. Array indexes never cover.
     */
    private boolean isCovering(String alias, IndexEntry entry) {
        if (entry.index().hasArrayKey()) {
            return false;
        }
        Set<Expression> paths = new LinkedHashSet<>();
        for (Expression expr : statementExprs) {
            if (!collectPaths(expr, alias, paths)) {
                return false;
            }
        }
        Set<Expression> keys = new LinkedHashSet<>();
        for (IndexKey key : entry.keys()) {
            keys.add(key.expression());
        }
        Expression documentKey = Expressions.documentKey(alias);
        for (Expression path : paths) {
            if (!keys.contains(path) && !path.equals(documentKey)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects the field paths rooted at an alias. Returns false when the
     * expression needs the whole document.
     */
    private static boolean collectPaths(Expression expr, String alias, Set<Expression> paths) {
        if (expr instanceof Field || expr instanceof Element) {
            Expression root = root(expr);
            if (isAliasRoot(root, alias)) {
                paths.add(expr);
                return true;
            }
        }
        if (isAliasRoot(expr, alias)) {
            return false;
        }
        for (Expression child : expr.children()) {
            if (!collectPaths(child, alias, paths)) {
                return false;
            }
        }
        return true;
    }

    private static Expression root(Expression expr) {
        Expression current = expr;
        while (true) {
            if (current instanceof Field) {
                current = ((Field) current).base();
            } else if (current instanceof Element) {
                current = ((Element) current).base();
            } else {
                return current;
            }
        }
    }

    private static boolean isAliasRoot(Expression expr, String alias) {
        return (expr instanceof Identifier && ((Identifier) expr).name().equals(alias))
            || (expr instanceof Meta && ((Meta) expr).alias().equals(alias));
    }

    // ==================== Filter bookkeeping ====================

    private void markSargedFilters(BaseKeyspace keyspace, List<IndexEntry> entries, boolean join) {
        int fanout = context.config().spanFanout();
        for (Filter filter : keyspace.filters()) {
            for (IndexEntry entry : entries) {
                boolean used = false;
                for (int i = 0; i < entry.sargKeys() && !used; i++) {
                    used = new KeySarger(entry.keys().get(i), keyspace.alias(), join, fanout)
                        .sarg(filter.fltrExpr()) != null;
                }
                if (used) {
                    filter.setFlag(Filter.Flag.IN_INDEX_SPAN);
                    break;
                }
            }
        }
    }

    private static void markAllFilters(BaseKeyspace keyspace) {
        for (Filter filter : keyspace.filters()) {
            filter.setFlag(Filter.Flag.IN_INDEX_SPAN);
        }
    }
}
