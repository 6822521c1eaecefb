package com.sargasso.plan;

import com.sargasso.expression.Expression;

/**
 * Skips {@code offset} rows, then passes at most {@code limit} rows.
 */
public final class LimitOperator extends PlanOperator {

    private final Expression limit;
    private final Expression offset;

    /**
     * Creates a limit.
     *
     * @param child the input
     * @param limit the row limit, or null for none
     * @param offset the rows to skip, or null for none
     */
    public LimitOperator(PlanOperator child, Expression limit, Expression offset) {
        super(child);
        if (limit == null && offset == null) {
            throw new IllegalArgumentException("limit or offset is required");
        }
        this.limit = limit;
        this.offset = offset;
    }

    public Expression limit() {
        return limit;
    }

    public Expression offset() {
        return offset;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("Limit(");
        if (offset != null) {
            sb.append("offset=").append(offset.toSQL());
        }
        if (limit != null) {
            if (offset != null) {
                sb.append(", ");
            }
            sb.append("limit=").append(limit.toSQL());
        }
        return sb.append(')').toString();
    }
}
