package com.sargasso.plan;

import com.sargasso.expression.Expression;

/**
 * Runs the right-hand scan once per left row, with the join values of the left
 * row available to the right side's index spans.
 */
public final class NestedLoopJoin extends JoinOperator {

    public NestedLoopJoin(PlanOperator left, PlanOperator right, String alias,
                          Expression onclause, boolean outer, boolean nest) {
        super(left, right, alias, onclause, outer, nest);
    }

    @Override
    public String describe() {
        return String.format("NestedLoop%s(%s, on=%s)", joinKeyword(), alias(), onclause().toSQL());
    }
}
