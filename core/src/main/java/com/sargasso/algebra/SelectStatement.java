package com.sargasso.algebra;

import com.sargasso.expression.Expression;
import java.util.List;
import java.util.Objects;

/**
 * The parts of a SELECT statement the planner reasons about.
 *
 * <p>Projection, ordering and grouping are only consulted for covering-index
 * and first-row decisions; their evaluation belongs to later stages.
 */
public final class SelectStatement {

    private final FromTerm from;
    private final Expression where;
    private final List<Expression> projection;
    private final Expression limit;
    private final Expression offset;
    private final boolean ordered;
    private final boolean grouped;

    private SelectStatement(Builder builder) {
        this.from = Objects.requireNonNull(builder.from, "from must not be null");
        this.where = builder.where;
        this.projection = List.copyOf(builder.projection);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.ordered = builder.ordered;
        this.grouped = builder.grouped;
    }

    public static Builder from(FromTerm from) {
        return new Builder(from);
    }

    public FromTerm from() {
        return from;
    }

    /**
     * Returns the WHERE clause.
     *
     * @return the predicate, or null if absent
     */
    public Expression where() {
        return where;
    }

    public List<Expression> projection() {
        return projection;
    }

    public Expression limit() {
        return limit;
    }

    public Expression offset() {
        return offset;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public boolean isGrouped() {
        return grouped;
    }

    /**
     * Returns whether only the first rows matter: a LIMIT without ORDER BY or GROUP BY.
     */
    public boolean isFirstRowsOnly() {
        return limit != null && !ordered && !grouped;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        sb.append(projection.isEmpty() ? "*" : projection.toString()).append(" FROM ").append(from);
        if (where != null) sb.append(" WHERE ").append(where.toSQL());
        if (grouped) sb.append(" GROUP BY ...");
        if (ordered) sb.append(" ORDER BY ...");
        if (offset != null) sb.append(" OFFSET ").append(offset.toSQL());
        if (limit != null) sb.append(" LIMIT ").append(limit.toSQL());
        return sb.toString();
    }

    /**
     * Builder for statements.
     */
    public static final class Builder {
        private final FromTerm from;
        private Expression where;
        private List<Expression> projection = List.of();
        private Expression limit;
        private Expression offset;
        private boolean ordered;
        private boolean grouped;

        private Builder(FromTerm from) {
            this.from = from;
        }

        public Builder where(Expression where) {
            this.where = where;
            return this;
        }

        public Builder select(Expression... projection) {
            this.projection = List.of(projection);
            return this;
        }

        public Builder limit(Expression limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Expression offset) {
            this.offset = offset;
            return this;
        }

        public Builder orderBy() {
            this.ordered = true;
            return this;
        }

        public Builder groupBy() {
            this.grouped = true;
            return this;
        }

        public SelectStatement build() {
            return new SelectStatement(this);
        }
    }
}
