package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Deep membership test ({@code expr WITHIN collection}): true if the operand equals any
 * value nested at any depth inside the collection.
 */
public final class Within implements Expression {

    private final Expression operand;
    private final Expression collection;

    public Within(Expression operand, Expression collection) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    public Expression operand() {
        return operand;
    }

    public Expression collection() {
        return collection;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitWithin(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(operand, collection));
    }

    @Override
    public String toSQL() {
        return "(" + operand.toSQL() + " WITHIN " + collection.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Within)) return false;
        Within other = (Within) obj;
        return operand.equals(other.operand) && collection.equals(other.collection);
    }

    @Override
    public int hashCode() {
        return Objects.hash("WITHIN", operand, collection);
    }
}
