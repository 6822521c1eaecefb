package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.List;

/**
 * Builds a hash table from one input and probes it with the other.
 *
 * <p>The right-hand subtree is planned without the left side's values. When the
 * build side is the left input the roles of the children are swapped at
 * execution; the build expressions always evaluate over the build side.
 */
public final class HashJoin extends JoinOperator {

    private final List<Expression> buildExprs;
    private final List<Expression> probeExprs;
    private final boolean buildRight;

    /**
     * Creates a hash join.
     *
     * @param left the left input
     * @param right the right-hand subtree
     * @param alias the right-hand alias
     * @param onclause the ON clause
     * @param outer whether the join is outer
     * @param nest whether the join is a nest
     * @param buildExprs the hash keys of the build side
     * @param probeExprs the hash keys of the probe side, pairwise with the build keys
     * @param buildRight whether the right-hand side is the build side
     */
    public HashJoin(PlanOperator left, PlanOperator right, String alias, Expression onclause,
                    boolean outer, boolean nest, List<Expression> buildExprs,
                    List<Expression> probeExprs, boolean buildRight) {
        super(left, right, alias, onclause, outer, nest);
        if (buildExprs.isEmpty() || buildExprs.size() != probeExprs.size()) {
            throw new IllegalArgumentException("Hash join needs matching, non-empty build and probe keys");
        }
        this.buildExprs = List.copyOf(buildExprs);
        this.probeExprs = List.copyOf(probeExprs);
        this.buildRight = buildRight;
    }

    public List<Expression> buildExprs() {
        return buildExprs;
    }

    public List<Expression> probeExprs() {
        return probeExprs;
    }

    public boolean isBuildRight() {
        return buildRight;
    }

    @Override
    public String describe() {
        return String.format("Hash%s(%s, build=%s %s, probe=%s)", joinKeyword(), alias(),
            buildRight ? "right" : "left", render(buildExprs), render(probeExprs));
    }

    private static String render(List<Expression> exprs) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(exprs.get(i).toSQL());
        }
        return sb.append(']').toString();
    }
}
