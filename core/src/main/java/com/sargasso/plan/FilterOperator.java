package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Keeps the rows of its child for which a condition is TRUE.
 */
public final class FilterOperator extends PlanOperator {

    private final Expression condition;

    public FilterOperator(PlanOperator child, Expression condition) {
        super(child);
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    public PlanOperator child() {
        return children.get(0);
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public String describe() {
        return "Filter(" + condition.toSQL() + ")";
    }
}
