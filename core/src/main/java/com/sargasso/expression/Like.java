package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pattern match: {@code expr LIKE pattern} or {@code REGEXP_LIKE(expr, pattern)}.
 *
 * <p>LIKE patterns use {@code %} and {@code _} as wildcards. Regular expressions
 * must match the whole string.
 */
public final class Like implements Expression {

    private final Expression operand;
    private final Expression pattern;
    private final boolean regex;

    public Like(Expression operand, Expression pattern, boolean regex) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.regex = regex;
    }

    public static Like like(Expression operand, Expression pattern) {
        return new Like(operand, pattern, false);
    }

    public static Like regexpLike(Expression operand, Expression pattern) {
        return new Like(operand, pattern, true);
    }

    public Expression operand() {
        return operand;
    }

    public Expression pattern() {
        return pattern;
    }

    public boolean isRegex() {
        return regex;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLike(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(operand, pattern));
    }

    @Override
    public String toSQL() {
        if (regex) {
            return "REGEXP_LIKE(" + operand.toSQL() + ", " + pattern.toSQL() + ")";
        }
        return "(" + operand.toSQL() + " LIKE " + pattern.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Like)) return false;
        Like other = (Like) obj;
        return regex == other.regex && operand.equals(other.operand) && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash("LIKE", operand, pattern, regex);
    }
}
