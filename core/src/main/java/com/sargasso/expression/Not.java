package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical negation. MISSING and NULL negate to themselves.
 */
public final class Not implements Expression {

    private final Expression operand;

    public Not(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toSQL() {
        return "(NOT " + operand.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Not)) return false;
        return operand.equals(((Not) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash("NOT", operand);
    }
}
