package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named or positional query parameter ({@code $name} or {@code $1}).
 *
 * <p>A parameter is constant for the whole execution, so it may bound an index
 * span, but its value is unknown while planning.
 */
public final class Parameter implements Expression {

    private final String name;

    public Parameter(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        return "$" + name;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Parameter)) return false;
        return name.equals(((Parameter) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("$", name);
    }
}
