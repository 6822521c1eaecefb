package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Arithmetic or string concatenation over two operands.
 *
 * <p>Arithmetic values are never predicates by themselves, but a MISSING or
 * NULL operand makes the result MISSING or NULL.
 */
public final class Arithmetic implements Expression {

    /**
     * Arithmetic operators.
     */
    public enum Operator {
        ADD("+", "addition"),
        SUB("-", "subtraction"),
        MULT("*", "multiplication"),
        DIV("/", "division"),
        MOD("%", "modulo"),
        CONCAT("||", "concatenation");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public Arithmetic(Operator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression left() {
        return left;
    }

    public Expression right() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(left, right));
    }

    @Override
    public String toSQL() {
        return "(" + left.toSQL() + " " + operator.symbol() + " " + right.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Arithmetic)) return false;
        Arithmetic other = (Arithmetic) obj;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}
