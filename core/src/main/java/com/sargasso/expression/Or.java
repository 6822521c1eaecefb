package com.sargasso.expression;

import java.util.List;
import java.util.Objects;

/**
 * N-ary disjunction.
 *
 * <p>Under three-valued logic the result is TRUE if any operand is TRUE,
 * otherwise NULL or MISSING if any operand is, otherwise FALSE.
 */
public final class Or implements Expression {

    private final List<Expression> operands;

    /**
     * Creates a disjunction.
     *
     * @param operands the operands, at least two
     */
    public Or(List<Expression> operands) {
        Objects.requireNonNull(operands, "operands must not be null");
        if (operands.size() < 2) {
            throw new IllegalArgumentException("OR requires at least two operands, got " + operands.size());
        }
        this.operands = List.copyOf(operands);
    }

    public Or(Expression... operands) {
        this(List.of(operands));
    }

    public List<Expression> operands() {
        return operands;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public String toSQL() {
        return Expressions.join(operands, " OR ");
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Or)) return false;
        return operands.equals(((Or) obj).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("OR", operands);
    }
}
