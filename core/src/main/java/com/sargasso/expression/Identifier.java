package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression naming a data-source alias or a quantifier binding variable.
 *
 * <p>A path such as {@code a.x.y} is a chain of {@link Field} nodes rooted at
 * the identifier {@code a}.
 */
public final class Identifier implements Expression {

    private final String name;

    public Identifier(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        return name;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Identifier)) return false;
        return name.equals(((Identifier) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
