package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression comparing two operands.
 *
 * <p>Comparisons follow missing/null propagation: if either operand is MISSING
 * the result is MISSING, otherwise if either is NULL the result is NULL.
 *
 * <p>Examples:
 * <pre>
 *   a.x = 1
 *   a.id = b.aid
 *   a.age >= 21
 * </pre>
 */
public final class Comparison implements Expression {

    /**
     * Comparison operators.
     */
    public enum Operator {
        EQ("=", "equal"),
        NE("!=", "not equal"),
        LT("<", "less than"),
        LE("<=", "less than or equal"),
        GT(">", "greater than"),
        GE(">=", "greater than or equal");

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

        /**
         * Returns the operator that gives the same result with the operands swapped.
         *
         * @return the mirrored operator ({@code a < b} is {@code b > a})
         */
        public Operator mirror() {
            switch (this) {
                case LT: return GT;
                case LE: return GE;
                case GT: return LT;
                case GE: return LE;
                default: return this;
            }
        }

        /**
         * Returns the operator computing the negation under three-valued logic.
         *
         * @return the negated operator ({@code NOT a < b} is {@code a >= b})
         */
        public Operator negate() {
            switch (this) {
                case EQ: return NE;
                case NE: return EQ;
                case LT: return GE;
                case LE: return GT;
                case GT: return LE;
                case GE: return LT;
                default: throw new IllegalStateException("Unknown operator: " + this);
            }
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    /**
     * Creates a comparison.
     *
     * @param operator the operator
     * @param left the left operand
     * @param right the right operand
     */
    public Comparison(Operator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    // ==================== Factory Methods ====================

    public static Comparison eq(Expression left, Expression right) {
        return new Comparison(Operator.EQ, left, right);
    }

    public static Comparison ne(Expression left, Expression right) {
        return new Comparison(Operator.NE, left, right);
    }

    public static Comparison lt(Expression left, Expression right) {
        return new Comparison(Operator.LT, left, right);
    }

    public static Comparison le(Expression left, Expression right) {
        return new Comparison(Operator.LE, left, right);
    }

    public static Comparison gt(Expression left, Expression right) {
        return new Comparison(Operator.GT, left, right);
    }

    public static Comparison ge(Expression left, Expression right) {
        return new Comparison(Operator.GE, left, right);
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
        return visitor.visitComparison(this);
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
        if (!(obj instanceof Comparison)) return false;
        Comparison other = (Comparison) obj;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }
}
