package com.sargasso.algebra;

import com.sargasso.expression.Expression;
import java.util.List;
import java.util.Objects;

/**
 * A keyspace scanned under an alias, with optional hints.
 *
 * <p>Examples:
 * <pre>
 *   orders AS o
 *   orders AS o USE KEYS ["o1", "o2"]
 *   orders AS o USE INDEX (ix_status)
 *   customers AS c USE HASH(BUILD)
 * </pre>
 */
public final class KeyspaceTerm implements SimpleTerm {

    private final String path;
    private final String alias;
    private final JoinHint joinHint;
    private final List<String> indexHints;
    private final Expression useKeys;

    private KeyspaceTerm(Builder builder) {
        this.path = Objects.requireNonNull(builder.path, "path must not be null");
        this.alias = builder.alias != null ? builder.alias : builder.path;
        this.joinHint = Objects.requireNonNull(builder.joinHint, "joinHint must not be null");
        this.indexHints = List.copyOf(builder.indexHints);
        this.useKeys = builder.useKeys;
    }

    /**
     * Creates an unhinted term.
     *
     * @param path the keyspace path
     * @param alias the alias
     * @return the term
     */
    public static KeyspaceTerm of(String path, String alias) {
        return builder(path).alias(alias).build();
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public String path() {
        return path;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public JoinHint joinHint() {
        return joinHint;
    }

    /**
     * Returns the index names from a {@code USE INDEX} hint.
     *
     * @return the hinted index names, empty if there is no hint
     */
    public List<String> indexHints() {
        return indexHints;
    }

    /**
     * Returns the {@code USE KEYS} expression.
     *
     * @return the keys, or null if the term has none
     */
    public Expression useKeys() {
        return useKeys;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(path).append(" AS ").append(alias);
        if (useKeys != null) {
            sb.append(" USE KEYS ").append(useKeys.toSQL());
        }
        if (!indexHints.isEmpty()) {
            sb.append(" USE INDEX (").append(String.join(", ", indexHints)).append(")");
        }
        if (joinHint != JoinHint.NONE) {
            sb.append(" ").append(joinHint);
        }
        return sb.toString();
    }

    /**
     * Builder for keyspace terms.
     */
    public static final class Builder {
        private final String path;
        private String alias;
        private JoinHint joinHint = JoinHint.NONE;
        private List<String> indexHints = List.of();
        private Expression useKeys;

        private Builder(String path) {
            this.path = path;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder joinHint(JoinHint joinHint) {
            this.joinHint = joinHint;
            return this;
        }

        public Builder useIndex(String... names) {
            this.indexHints = List.of(names);
            return this;
        }

        public Builder useKeys(Expression keys) {
            this.useKeys = keys;
            return this;
        }

        public KeyspaceTerm build() {
            return new KeyspaceTerm(this);
        }
    }
}
