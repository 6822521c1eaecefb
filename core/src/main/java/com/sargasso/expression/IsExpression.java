package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Missing/null test ({@code expr IS [NOT] MISSING}, {@code IS [NOT] NULL}, {@code IS [NOT] VALUED}).
 */
public final class IsExpression implements Expression {

    /**
     * The tested condition.
     */
    public enum Kind {
        MISSING("IS MISSING"),
        NOT_MISSING("IS NOT MISSING"),
        NULL("IS NULL"),
        NOT_NULL("IS NOT NULL"),
        VALUED("IS VALUED"),
        NOT_VALUED("IS NOT VALUED");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * Returns the kind computing the negation of this test.
         *
         * @return the complementary kind
         */
        public Kind negate() {
            switch (this) {
                case MISSING: return NOT_MISSING;
                case NOT_MISSING: return MISSING;
                case NULL: return NOT_NULL;
                case NOT_NULL: return NULL;
                case VALUED: return NOT_VALUED;
                case NOT_VALUED: return VALUED;
                default: throw new IllegalStateException("Unknown kind: " + this);
            }
        }
    }

    private final Kind kind;
    private final Expression operand;

    public IsExpression(Kind kind, Expression operand) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIs(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toSQL() {
        return "(" + operand.toSQL() + " " + kind.keyword() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IsExpression)) return false;
        IsExpression other = (IsExpression) obj;
        return kind == other.kind && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, operand);
    }
}
