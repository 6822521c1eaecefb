package com.sargasso.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Metadata of the document bound to an alias ({@code META(alias)}).
 *
 * <p>The document key is {@code META(alias).id}, a {@link Field} named
 * {@code id} over this node.
 */
public final class Meta implements Expression {

    private final String alias;

    public Meta(String alias) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public String alias() {
        return alias;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMeta(this);
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSQL() {
        return "META(" + alias + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Meta)) return false;
        return alias.equals(((Meta) obj).alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash("META", alias);
    }
}
