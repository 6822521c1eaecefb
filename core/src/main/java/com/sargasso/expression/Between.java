package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Closed range test ({@code expr BETWEEN low AND high}).
 */
public final class Between implements Expression {

    private final Expression operand;
    private final Expression low;
    private final Expression high;

    public Between(Expression operand, Expression low, Expression high) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.low = Objects.requireNonNull(low, "low must not be null");
        this.high = Objects.requireNonNull(high, "high must not be null");
    }

    public Expression operand() {
        return operand;
    }

    public Expression low() {
        return low;
    }

    public Expression high() {
        return high;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBetween(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(operand, low, high));
    }

    @Override
    public String toSQL() {
        return "(" + operand.toSQL() + " BETWEEN " + low.toSQL() + " AND " + high.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Between)) return false;
        Between other = (Between) obj;
        return operand.equals(other.operand) && low.equals(other.low) && high.equals(other.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash("BETWEEN", operand, low, high);
    }
}
