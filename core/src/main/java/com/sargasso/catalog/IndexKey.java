package com.sargasso.catalog;

import com.sargasso.expression.Expression;
import com.sargasso.expression.Formalizer;
import java.util.Objects;

/**
 * One key position of an index.
 *
 * <p>A scalar key indexes the value of an expression. An array key
 * ({@code DISTINCT ARRAY element FOR variable IN collection END}) indexes every
 * element of a collection, so one document may produce several index entries.
 * Expressions are written over {@link Formalizer#DOCUMENT}.
 */
public final class IndexKey {

    private final Expression expression;
    private final boolean descending;
    private final Expression collection;
    private final String variable;

    private IndexKey(Expression expression, boolean descending, Expression collection, String variable) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.descending = descending;
        this.collection = collection;
        this.variable = variable;
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an ascending scalar key.
     *
     * @param expression the key expression
     * @return the key
     */
    public static IndexKey of(Expression expression) {
        return new IndexKey(expression, false, null, null);
    }

    public static IndexKey descending(Expression expression) {
        return new IndexKey(expression, true, null, null);
    }

    /**
     * Creates an array key {@code DISTINCT ARRAY element FOR variable IN collection END}.
     *
     * @param element the indexed element expression, over the variable
     * @param variable the element variable
     * @param collection the indexed collection
     * @return the key
     */
    public static IndexKey array(Expression element, String variable, Expression collection) {
        return new IndexKey(element,
            false,
            Objects.requireNonNull(collection, "collection must not be null"),
            Objects.requireNonNull(variable, "variable must not be null"));
    }

    /**
     * Returns the key expression; for an array key, the element expression.
     */
    public Expression expression() {
        return expression;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean isArray() {
        return collection != null;
    }

    /**
     * Returns the indexed collection of an array key.
     *
     * @return the collection, or null for a scalar key
     */
    public Expression collection() {
        return collection;
    }

    /**
     * Returns the element variable of an array key.
     *
     * @return the variable, or null for a scalar key
     */
    public String variable() {
        return variable;
    }

    /**
     * Binds this key to a query alias.
     *
     * @param alias the alias of the scanned keyspace
     * @return the key with its expressions formalized
     */
    public IndexKey formalize(String alias) {
        return new IndexKey(Formalizer.formalize(expression, alias), descending,
            Formalizer.formalize(collection, alias), variable);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IndexKey)) return false;
        IndexKey other = (IndexKey) obj;
        return descending == other.descending
            && expression.equals(other.expression)
            && Objects.equals(collection, other.collection)
            && Objects.equals(variable, other.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, descending, collection, variable);
    }

    @Override
    public String toString() {
        String text = isArray()
            ? "DISTINCT ARRAY " + expression.toSQL() + " FOR " + variable + " IN " + collection.toSQL() + " END"
            : expression.toSQL();
        return descending ? text + " DESC" : text;
    }
}
