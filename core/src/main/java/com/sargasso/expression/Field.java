package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Field access on an object-valued expression ({@code base.name}).
 */
public final class Field implements Expression {

    private final Expression base;
    private final String name;

    public Field(Expression base, String name) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public Expression base() {
        return base;
    }

    public String name() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(base);
    }

    @Override
    public String toSQL() {
        return base.toSQL() + "." + name;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Field)) return false;
        Field other = (Field) obj;
        return base.equals(other.base) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, name);
    }
}
