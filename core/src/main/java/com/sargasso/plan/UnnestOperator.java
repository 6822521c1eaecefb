package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Produces one row per element of an array of each input row.
 */
public final class UnnestOperator extends PlanOperator {

    private final String alias;
    private final Expression expression;
    private final boolean outer;

    public UnnestOperator(PlanOperator child, String alias, Expression expression, boolean outer) {
        super(child);
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.outer = outer;
    }

    public String alias() {
        return alias;
    }

    public Expression expression() {
        return expression;
    }

    public boolean isOuter() {
        return outer;
    }

    @Override
    public String describe() {
        return String.format("%sUnnest(%s AS %s)", outer ? "Outer" : "", expression.toSQL(), alias);
    }
}
