package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Array element access ({@code base[index]}).
 */
public final class Element implements Expression {

    private final Expression base;
    private final Expression index;

    public Element(Expression base, Expression index) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    public Expression base() {
        return base;
    }

    public Expression index() {
        return index;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitElement(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(base, index));
    }

    @Override
    public String toSQL() {
        return base.toSQL() + "[" + index.toSQL() + "]";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Element)) return false;
        Element other = (Element) obj;
        return base.equals(other.base) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, index, "[]");
    }
}
