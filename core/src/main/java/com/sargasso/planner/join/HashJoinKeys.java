package com.sargasso.planner.join;

import com.sargasso.expression.Comparison;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.planner.base.Filter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Build and probe expressions of a hash join, pairwise.
 *
 * @param buildExprs the keys evaluated on the build side
 * @param probeExprs the keys evaluated on the probe side
 * @param filters the join filters the keys came from
 */
public record HashJoinKeys(List<Expression> buildExprs, List<Expression> probeExprs, List<Filter> filters) {

    public HashJoinKeys {
        buildExprs = List.copyOf(buildExprs);
        probeExprs = List.copyOf(probeExprs);
        filters = List.copyOf(filters);
    }

    public boolean isEmpty() {
        return buildExprs.isEmpty();
    }

    /**
     * Extracts hash keys from the join filters of a right-hand alias.
     *
     * <p>A filter qualifies when it is an equality whose one side refers only to
     * the right-hand alias and whose other side refers only to aliases already
     * planned, and to at least one of them.
     *
     * @param filters the filters of the right-hand keyspace
     * @param alias the right-hand alias
     * @param planned the aliases already planned
     * @param allAliases every alias of the statement
     * @param buildRight whether the right-hand side is the build side
     * @return the keys, empty when no filter qualifies
     */
    public static HashJoinKeys extract(Collection<Filter> filters, String alias, Set<String> planned,
                                       Set<String> allAliases, boolean buildRight) {
        List<Expression> rightExprs = new ArrayList<>();
        List<Expression> leftExprs = new ArrayList<>();
        List<Filter> used = new ArrayList<>();
        for (Filter filter : filters) {
            if (!filter.isJoin() || !(filter.fltrExpr() instanceof Comparison)) {
                continue;
            }
            Comparison eq = (Comparison) filter.fltrExpr();
            if (eq.operator() != Comparison.Operator.EQ
                    || Expressions.containsSubquery(eq.left()) || Expressions.containsSubquery(eq.right())) {
                continue;
            }
            Set<String> leftRefs = Expressions.referencedAliases(eq.left(), allAliases);
            Set<String> rightRefs = Expressions.referencedAliases(eq.right(), allAliases);
            if (isRightSide(leftRefs, alias) && isLeftSide(rightRefs, alias, planned)) {
                rightExprs.add(eq.left());
                leftExprs.add(eq.right());
                used.add(filter);
            } else if (isRightSide(rightRefs, alias) && isLeftSide(leftRefs, alias, planned)) {
                rightExprs.add(eq.right());
                leftExprs.add(eq.left());
                used.add(filter);
            }
        }
        return buildRight
            ? new HashJoinKeys(rightExprs, leftExprs, used)
            : new HashJoinKeys(leftExprs, rightExprs, used);
    }

    private static boolean isRightSide(Set<String> refs, String alias) {
        return refs.size() == 1 && refs.contains(alias);
    }

    private static boolean isLeftSide(Set<String> refs, String alias, Set<String> planned) {
        return !refs.isEmpty() && !refs.contains(alias) && planned.containsAll(refs);
    }
}
