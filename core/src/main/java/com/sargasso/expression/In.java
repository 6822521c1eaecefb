package com.sargasso.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Membership test against an array-valued expression ({@code expr IN collection}).
 *
 * <p>Examples:
 * <pre>
 *   a.x IN [1, 2, 3]
 *   META(b).id IN a.refs
 * </pre>
 */
public final class In implements Expression {

    private final Expression operand;
    private final Expression collection;

    public In(Expression operand, Expression collection) {
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
        return visitor.visitIn(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.unmodifiableList(Arrays.asList(operand, collection));
    }

    @Override
    public String toSQL() {
        return "(" + operand.toSQL() + " IN " + collection.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof In)) return false;
        In other = (In) obj;
        return operand.equals(other.operand) && collection.equals(other.collection);
    }

    @Override
    public int hashCode() {
        return Objects.hash("IN", operand, collection);
    }
}
