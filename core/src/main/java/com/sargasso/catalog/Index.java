package com.sargasso.catalog;

import com.sargasso.expression.Expression;
import com.sargasso.expression.Formalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Catalog description of an index on a keyspace.
 *
 * <p>A primary index has the single key {@code META(#doc).id} and contains every
 * document. A secondary index has ordered keys and may carry a condition,
 * in which case it only contains documents satisfying that condition.
 */
public final class Index {

    private final String name;
    private final List<IndexKey> keys;
    private final Expression condition;
    private final boolean primary;
    private final boolean partitioned;
    private final IndexState state;

    private Index(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.keys = List.copyOf(builder.keys);
        this.condition = builder.condition;
        this.primary = builder.primary;
        this.partitioned = builder.partitioned;
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Index " + name + " must have at least one key");
        }
    }

    /**
     * Creates an online primary index.
     *
     * @param name the index name
     * @return the index
     */
    public static Index primary(String name) {
        Builder builder = builder(name).key(IndexKey.of(Formalizer.documentKey()));
        builder.primary = true;
        return builder.build();
    }

    /**
     * Starts building a secondary index.
     *
     * @param name the index name
     * @return a builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<IndexKey> keys() {
        return keys;
    }

    /**
     * Returns the index condition.
     *
     * @return the condition, or null if the index contains every document with a leading key
     */
    public Expression condition() {
        return condition;
    }

    public boolean isPrimary() {
        return primary;
    }

    public boolean isPartitioned() {
        return partitioned;
    }

    public IndexState state() {
        return state;
    }

    public boolean isOnline() {
        return state == IndexState.ONLINE;
    }

    /**
     * Returns whether any key of this index is an array key.
     */
    public boolean hasArrayKey() {
        for (IndexKey key : keys) {
            if (key.isArray()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Index)) return false;
        Index other = (Index) obj;
        return name.equals(other.name) && keys.equals(other.keys)
            && Objects.equals(condition, other.condition)
            && primary == other.primary && partitioned == other.partitioned && state == other.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keys, condition, primary, partitioned, state);
    }

    @Override
    public String toString() {
        return String.format("Index(%s, keys=%s%s%s)", name, keys,
            condition != null ? ", where=" + condition.toSQL() : "",
            primary ? ", primary" : "");
    }

    /**
     * Builder for secondary indexes.
     */
    public static final class Builder {
        private final String name;
        private final List<IndexKey> keys = new ArrayList<>();
        private Expression condition;
        private boolean primary;
        private boolean partitioned;
        private IndexState state = IndexState.ONLINE;

        private Builder(String name) {
            this.name = name;
        }

        public Builder key(IndexKey key) {
            keys.add(Objects.requireNonNull(key, "key must not be null"));
            return this;
        }

        /**
         * Adds an ascending scalar key.
         */
        public Builder key(Expression expression) {
            return key(IndexKey.of(expression));
        }

        public Builder condition(Expression condition) {
            this.condition = condition;
            return this;
        }

        public Builder partitioned(boolean partitioned) {
            this.partitioned = partitioned;
            return this;
        }

        public Builder state(IndexState state) {
            this.state = state;
            return this;
        }

        public Index build() {
            return new Index(this);
        }
    }
}
