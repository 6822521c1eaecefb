package com.sargasso.expression;

import java.util.List;
import java.util.Objects;

/**
 * Array constructor ({@code [e1, e2, ...]}).
 */
public final class ArrayConstruct implements Expression {

    private final List<Expression> elements;

    public ArrayConstruct(List<Expression> elements) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public ArrayConstruct(Expression... elements) {
        this(List.of(elements));
    }

    public List<Expression> elements() {
        return elements;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayConstruct(this);
    }

    @Override
    public List<Expression> children() {
        return elements;
    }

    @Override
    public String toSQL() {
        return "[" + Expressions.join(elements, ", ") + "]";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayConstruct)) return false;
        return elements.equals(((ArrayConstruct) obj).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash("[]", elements);
    }
}
