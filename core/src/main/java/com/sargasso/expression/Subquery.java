package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A nested query, opaque to the planner apart from the outer aliases it refers to.
 *
 * <p>A subquery that refers to outer aliases is correlated: it must be
 * re-evaluated for each outer row and cannot be built independently.
 */
public final class Subquery implements Expression {

    private final String text;
    private final Set<String> correlatedAliases;

    /**
     * Creates a subquery.
     *
     * @param text the query text, for display
     * @param correlatedAliases outer aliases the subquery refers to
     */
    public Subquery(String text, Set<String> correlatedAliases) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.correlatedAliases = Collections.unmodifiableSet(
            new TreeSet<>(Objects.requireNonNull(correlatedAliases, "correlatedAliases must not be null")));
    }

    public static Subquery uncorrelated(String text) {
        return new Subquery(text, Set.of());
    }

    public String text() {
        return text;
    }

    public Set<String> correlatedAliases() {
        return correlatedAliases;
    }

    public boolean isCorrelated() {
        return !correlatedAliases.isEmpty();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSubquery(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        return "(" + text + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Subquery)) return false;
        Subquery other = (Subquery) obj;
        return text.equals(other.text) && correlatedAliases.equals(other.correlatedAliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, correlatedAliases);
    }
}
