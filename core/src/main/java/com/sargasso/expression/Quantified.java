package com.sargasso.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collection predicate: {@code ANY | EVERY | ANY AND EVERY v IN coll SATISFIES cond END}.
 *
 * <p>Each binding introduces a variable ranging over the elements of its
 * expression. Later bindings may refer to earlier ones.
 */
public final class Quantified implements Expression {

    /**
     * The quantifier.
     */
    public enum Kind {
        ANY("ANY"),
        EVERY("EVERY"),
        ANY_EVERY("ANY AND EVERY");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    /**
     * One {@code variable IN expression} binding.
     *
     * @param variable the bound variable name
     * @param expression the collection the variable ranges over
     */
    public record Binding(String variable, Expression expression) {
        public Binding {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    private final Kind kind;
    private final List<Binding> bindings;
    private final Expression satisfies;

    public Quantified(Kind kind, List<Binding> bindings, Expression satisfies) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(bindings, "bindings must not be null");
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException(kind.keyword() + " requires at least one binding");
        }
        this.bindings = List.copyOf(bindings);
        this.satisfies = Objects.requireNonNull(satisfies, "satisfies must not be null");
    }

    /**
     * Creates {@code ANY variable IN collection SATISFIES satisfies END}.
     */
    public static Quantified any(String variable, Expression collection, Expression satisfies) {
        return new Quantified(Kind.ANY, List.of(new Binding(variable, collection)), satisfies);
    }

    /**
     * Creates {@code EVERY variable IN collection SATISFIES satisfies END}.
     */
    public static Quantified every(String variable, Expression collection, Expression satisfies) {
        return new Quantified(Kind.EVERY, List.of(new Binding(variable, collection)), satisfies);
    }

    public Kind kind() {
        return kind;
    }

    public List<Binding> bindings() {
        return bindings;
    }

    public Expression satisfies() {
        return satisfies;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitQuantified(this);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>();
        for (Binding binding : bindings) {
            children.add(binding.expression());
        }
        children.add(satisfies);
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toSQL() {
        StringBuilder sb = new StringBuilder(kind.keyword()).append(' ');
        for (int i = 0; i < bindings.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(bindings.get(i).variable()).append(" IN ").append(bindings.get(i).expression().toSQL());
        }
        return sb.append(" SATISFIES ").append(satisfies.toSQL()).append(" END").toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Quantified)) return false;
        Quantified other = (Quantified) obj;
        return kind == other.kind && bindings.equals(other.bindings) && satisfies.equals(other.satisfies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bindings, satisfies);
    }
}
