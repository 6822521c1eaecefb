package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Iterates the values of an expression or subquery FROM term.
 */
public final class ExpressionScan extends PlanOperator {

    private final String alias;
    private final Expression expression;
    private final boolean correlated;

    public ExpressionScan(String alias, Expression expression, boolean correlated) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.correlated = correlated;
    }

    public String alias() {
        return alias;
    }

    public Expression expression() {
        return expression;
    }

    public boolean isCorrelated() {
        return correlated;
    }

    @Override
    public String describe() {
        return String.format("ExpressionScan(%s, %s%s)", alias, expression.toSQL(), correlated ? ", correlated" : "");
    }
}
