package com.sargasso.planner.join;

import com.sargasso.algebra.AnsiJoin;
import com.sargasso.algebra.ExpressionTerm;
import com.sargasso.algebra.JoinHint;
import com.sargasso.algebra.KeyspaceTerm;
import com.sargasso.algebra.SimpleTerm;
import com.sargasso.algebra.SubqueryTerm;
import com.sargasso.cost.Cost;
import com.sargasso.cost.CostOracle;
import com.sargasso.cost.JoinMethod;
import com.sargasso.exception.NoAccessPathException;
import com.sargasso.exception.PlanErrorCode;
import com.sargasso.exception.PlanningException;
import com.sargasso.expression.Expressions;
import com.sargasso.plan.Fetch;
import com.sargasso.plan.HashJoin;
import com.sargasso.plan.JoinOperator;
import com.sargasso.plan.KeyScan;
import com.sargasso.plan.LookupJoin;
import com.sargasso.plan.NestedLoopJoin;
import com.sargasso.plan.PlanOperator;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.scan.ScanBuilder;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses between a hash join and a nested-loop join for one ANSI join or nest.
 *
 * <p>Both alternatives are built from the same {@link BuilderState}:
 * <ol>
 *   <li>Hash: when hash joins are enabled and either hinted or a cost oracle is
 *       present. The right-hand term is scanned without the join filters and
 *       equality join filters become build and probe keys.</li>
 *   <li>Nested loop: the right-hand term is scanned with the join filters, so
 *       the join key can drive index selection. An equality on the right-hand
 *       document key becomes a primary lookup join.</li>
 * </ol>
 * With a cost oracle and two feasible alternatives the cheaper one wins;
 * otherwise a feasible hash join wins when hinted or when the right-hand side
 * is an expression or subquery term, else the nested-loop join.
 * The transient filter flags of the losing attempt are discarded.
 */
public final class JoinStrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(JoinStrategySelector.class);

    private final FilterRegistry registry;
    private final PlanContext context;
    private final ScanBuilder scanBuilder;
    private final boolean firstRowsOnly;

    /**
     * Creates a selector for one statement.
     *
     * @param registry the statement's filter registry
     * @param context the planning context
     * @param scanBuilder the scan builder of the statement
     * @param firstRowsOnly whether only the first rows of the result are needed
     */
    public JoinStrategySelector(FilterRegistry registry, PlanContext context,
                                ScanBuilder scanBuilder, boolean firstRowsOnly) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.scanBuilder = Objects.requireNonNull(scanBuilder, "scanBuilder must not be null");
        this.firstRowsOnly = firstRowsOnly;
    }

    /**
     * Plans a join on top of the current state.
     *
     * @param join the join or nest
     * @param state the plan of the terms to its left
     * @return the chosen candidate
     * @throws NoAccessPathException if neither strategy is feasible
     */
    public JoinCandidate build(AnsiJoin join, BuilderState state) {
        List<JoinCandidate> candidates = explore(join, state);
        JoinCandidate chosen = select(join, candidates);
        apply(join, chosen);
        logger.debug("Join on {}: {} {}", join.alias(), chosen.strategy(), chosen.cost());
        return chosen;
    }

    /**
     * Builds every feasible alternative, hash first.
     *
     * <p>Transient filter flags are left cleared; {@link #build} applies the
     * flags of the chosen candidate.
     *
     * @param join the join or nest
     * @param state the plan of the terms to its left
     * @return the feasible candidates, never empty
     * @throws NoAccessPathException if neither strategy is feasible
     */
    public List<JoinCandidate> explore(AnsiJoin join, BuilderState state) {
        BaseKeyspace keyspace = registry.get(join.alias());
        List<JoinCandidate> candidates = new ArrayList<>();

        registry.clearTransientFlags();
        tryHash(join, keyspace, state).ifPresent(candidates::add);
        keyspace.unsetFlag(BaseKeyspace.Flag.UNDER_HASH);

        registry.clearTransientFlags();
        PlanningException nlError = null;
        try {
            candidates.add(nestedLoop(join, keyspace, state));
        } catch (PlanningException e) {
            logger.debug("Nested-loop join on {} not feasible: {}", join.alias(), e.getMessage());
            nlError = e;
        }
        keyspace.unsetFlag(BaseKeyspace.Flag.UNDER_NL);
        registry.clearTransientFlags();

        if (candidates.isEmpty()) {
            if (context.isCostBased()) {
                throw new NoAccessPathException(PlanErrorCode.NO_ACCESS_PATH,
                    "No access path for " + join.kind() + " on " + join.alias(), join.alias(), nlError);
            }
            throw nlError;
        }
        return candidates;
    }

    // ==================== Hash join ====================

    private Optional<JoinCandidate> tryHash(AnsiJoin join, BaseKeyspace keyspace, BuilderState state) {
        SimpleTerm right = join.right();
        JoinHint hint = right.joinHint();
        if (!context.config().hashJoinEnabled() || hint == JoinHint.USE_NL) {
            return Optional.empty();
        }
        if (right instanceof KeyspaceTerm) {
            if (!hint.isHash() && !context.isCostBased()) {
                return Optional.empty();
            }
            KeyspaceTerm keyspaceTerm = (KeyspaceTerm) right;
            if (keyspaceTerm.useKeys() != null && !Expressions.isStatic(keyspaceTerm.useKeys())) {
                logger.debug("Hash join on {} not feasible: USE KEYS depends on the left side", join.alias());
                return Optional.empty();
            }
        } else if (isCorrelated(right)) {
            logger.debug("Hash join on {} not feasible: correlated term", join.alias());
            return Optional.empty();
        }
        if (hint == JoinHint.USE_HASH_PROBE && (join.isOuter() || join.isNest())) {
            context.hints().warn(join.alias(), "USE HASH (PROBE)",
                "the right-hand side of an outer join or nest must be the build side");
            return Optional.empty();
        }

        keyspace.setFlag(BaseKeyspace.Flag.UNDER_HASH);
        PlanOperator scan;
        try {
            scan = scanBuilder.build(keyspace, right, ScanBuilder.Mode.HASH);
        } catch (NoAccessPathException e) {
            logger.debug("Hash join on {} not feasible: {}", join.alias(), e.getMessage());
            return Optional.empty();
        }

        boolean buildRight = buildRight(join, hint, state.root(), scan);
        HashJoinKeys keys = HashJoinKeys.extract(keyspace.filters(), join.alias(),
            registry.plannedAliases(), registry.aliases(), buildRight);
        if (keys.isEmpty()) {
            logger.debug("Hash join on {} not feasible: no equality join filter", join.alias());
            return Optional.empty();
        }
        for (Filter filter : keys.filters()) {
            filter.setFlag(Filter.Flag.IN_HASH_JOIN);
        }

        HashJoin hashJoin = new HashJoin(state.root(), scan, join.alias(), join.onclause(),
            join.isOuter(), join.isNest(), keys.buildExprs(), keys.probeExprs(), buildRight);
        hashJoin.setCost(joinCost(JoinMethod.HASH, state.root().cost(), scan.cost(), buildRight));
        return Optional.of(new JoinCandidate(JoinStrategy.HASH, hashJoin,
            state.push(hashJoin, scan), snapshotFlags()));
    }

    private boolean isCorrelated(SimpleTerm term) {
        if (term instanceof SubqueryTerm) {
            return ((SubqueryTerm) term).isCorrelated();
        }
        return Expressions.references(((ExpressionTerm) term).expression(), registry.plannedAliases());
    }

    /**
     * Decides whether the right-hand side is the build side: as hinted, always
     * for outer joins and nests, the smaller side with cardinalities, otherwise yes.
     */
    private boolean buildRight(AnsiJoin join, JoinHint hint, PlanOperator left, PlanOperator right) {
        if (hint == JoinHint.USE_HASH_BUILD) {
            return true;
        }
        if (hint == JoinHint.USE_HASH_PROBE) {
            return false;
        }
        if (join.isOuter() || join.isNest()) {
            return true;
        }
        if (context.isCostBased() && left.cost().isAvailable() && right.cost().isAvailable()) {
            return right.cost().cardinality() <= left.cost().cardinality();
        }
        return true;
    }

    // ==================== Nested-loop join ====================

    private JoinCandidate nestedLoop(AnsiJoin join, BaseKeyspace keyspace, BuilderState state) {
        SimpleTerm right = join.right();
        keyspace.setFlag(BaseKeyspace.Flag.UNDER_NL);
        PlanOperator scan;
        try {
            scan = scanBuilder.build(keyspace, right, ScanBuilder.Mode.NESTED_LOOP);
        } catch (NoAccessPathException e) {
            throw new NoAccessPathException(PlanErrorCode.NO_JOIN_PATH,
                "No index for the join predicate on " + join.alias()
                    + "; create an index on the join key or use a hash join hint",
                join.alias(), e);
        }

        Optional<KeyScan> lookup = primaryLookup(scan);
        if (lookup.isPresent()) {
            LookupJoin lookupJoin = new LookupJoin(state.root(), scan, join.alias(), join.onclause(),
                join.isOuter(), join.isNest(), lookup.get().keys());
            lookupJoin.setCost(joinCost(JoinMethod.LOOKUP, state.root().cost(), scan.cost(), false));
            return new JoinCandidate(JoinStrategy.PRIMARY_LOOKUP, lookupJoin,
                state.push(lookupJoin, scan), snapshotFlags());
        }

        NestedLoopJoin nlJoin = new NestedLoopJoin(state.root(), scan, join.alias(), join.onclause(),
            join.isOuter(), join.isNest());
        nlJoin.setCost(joinCost(JoinMethod.NESTED_LOOP, state.root().cost(), scan.cost(), false));
        return new JoinCandidate(JoinStrategy.NESTED_LOOP, nlJoin, state.push(nlJoin, scan), snapshotFlags());
    }

    /**
     * A fetch by keys computed from the left side is a primary lookup.
     */
    private Optional<KeyScan> primaryLookup(PlanOperator scan) {
        if (scan instanceof Fetch && ((Fetch) scan).scan() instanceof KeyScan) {
            KeyScan keyScan = (KeyScan) ((Fetch) scan).scan();
            if (Expressions.references(keyScan.keys(), registry.plannedAliases())) {
                return Optional.of(keyScan);
            }
        }
        return Optional.empty();
    }

    // ==================== Selection ====================

    private JoinCandidate select(AnsiJoin join, List<JoinCandidate> candidates) {
        JoinHint hint = join.right().joinHint();
        JoinCandidate hash = null;
        JoinCandidate nl = null;
        for (JoinCandidate candidate : candidates) {
            if (candidate.isHash()) {
                hash = candidate;
            } else {
                nl = candidate;
            }
        }
        if (hash == null) {
            if (hint.isHash()) {
                context.hints().warn(join.alias(), hintText(hint), "hash join is not feasible");
            }
            return nl;
        }
        if (nl == null) {
            return hash;
        }
        if (context.isCostBased() && hash.cost().isAvailable() && nl.cost().isAvailable()) {
            double hashCost = hash.cost().effective(firstRowsOnly);
            double nlCost = nl.cost().effective(firstRowsOnly);
            if (hashCost < nlCost || (hashCost == nlCost && hint.isHash())) {
                return hash;
            }
            if (hint.isHash()) {
                context.hints().warn(join.alias(), hintText(hint), "nested-loop join is cheaper");
            }
            return nl;
        }
        // a hash join over an expression or subquery term needs no hint
        if (hint.isHash() || !(join.right() instanceof KeyspaceTerm)) {
            return hash;
        }
        return nl;
    }

    private void apply(AnsiJoin join, JoinCandidate chosen) {
        registry.clearTransientFlags();
        for (Map.Entry<Filter, EnumSet<Filter.Flag>> entry : chosen.filterFlags().entrySet()) {
            for (Filter.Flag flag : entry.getValue()) {
                entry.getKey().setFlag(flag);
            }
        }
        BaseKeyspace keyspace = registry.get(join.alias());
        keyspace.setFlag(chosen.isHash() ? BaseKeyspace.Flag.UNDER_HASH : BaseKeyspace.Flag.UNDER_NL);
    }

    private Map<Filter, EnumSet<Filter.Flag>> snapshotFlags() {
        Map<Filter, EnumSet<Filter.Flag>> flags = new IdentityHashMap<>();
        for (BaseKeyspace keyspace : registry.keyspaces()) {
            snapshot(keyspace.filters(), flags);
            snapshot(keyspace.joinFilters(), flags);
        }
        return flags;
    }

    private static void snapshot(List<Filter> filters, Map<Filter, EnumSet<Filter.Flag>> flags) {
        for (Filter filter : filters) {
            EnumSet<Filter.Flag> set = filter.transientFlags();
            if (!set.isEmpty()) {
                flags.put(filter, set);
            }
        }
    }

    private Cost joinCost(JoinMethod method, Cost left, Cost right, boolean buildRight) {
        Optional<CostOracle> oracle = context.costOracle();
        if (oracle.isEmpty() || !left.isAvailable() || !right.isAvailable()) {
            return Cost.NOT_AVAILABLE;
        }
        return oracle.get().joinCost(method, left, right, buildRight);
    }

    private static String hintText(JoinHint hint) {
        switch (hint) {
            case USE_HASH_BUILD:
                return "USE HASH (BUILD)";
            case USE_HASH_PROBE:
                return "USE HASH (PROBE)";
            case USE_NL:
                return "USE NL";
            default:
                return "";
        }
    }
}
