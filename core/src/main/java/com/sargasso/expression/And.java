package com.sargasso.expression;

import java.util.List;
import java.util.Objects;

/**
 * N-ary conjunction.
 *
 * <p>Under three-valued logic the result is FALSE if any operand is FALSE,
 * otherwise MISSING or NULL if any operand is, otherwise TRUE.
 */
public final class And implements Expression {

    private final List<Expression> operands;

    /**
     * Creates a conjunction.
     *
     * @param operands the operands, at least two
     */
    public And(List<Expression> operands) {
        Objects.requireNonNull(operands, "operands must not be null");
        if (operands.size() < 2) {
            throw new IllegalArgumentException("AND requires at least two operands, got " + operands.size());
        }
        this.operands = List.copyOf(operands);
    }

    public And(Expression... operands) {
        this(List.of(operands));
    }

    public List<Expression> operands() {
        return operands;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public String toSQL() {
        return Expressions.join(operands, " AND ");
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof And)) return false;
        return operands.equals(((And) obj).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("AND", operands);
    }
}
