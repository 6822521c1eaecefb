package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Arrays;
import java.util.Objects;

/**
 * Common state of the join operators: the left input, the subtree producing the
 * right-hand alias, the ON clause and the join kind.
 */
public abstract class JoinOperator extends PlanOperator {

    private final String alias;
    private final Expression onclause;
    private final boolean outer;
    private final boolean nest;

    protected JoinOperator(PlanOperator left, PlanOperator right, String alias,
                           Expression onclause, boolean outer, boolean nest) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.onclause = Objects.requireNonNull(onclause, "onclause must not be null");
        this.outer = outer;
        this.nest = nest;
    }

    public PlanOperator left() {
        return children.get(0);
    }

    public PlanOperator right() {
        return children.get(1);
    }

    /**
     * Returns the alias of the right-hand term.
     */
    public String alias() {
        return alias;
    }

    public Expression onclause() {
        return onclause;
    }

    public boolean isOuter() {
        return outer;
    }

    public boolean isNest() {
        return nest;
    }

    protected String joinKeyword() {
        return (outer ? "Outer" : "") + (nest ? "Nest" : "Join");
    }
}
