package com.sargasso.plan;

import com.sargasso.expression.Expression;
import java.util.Objects;

/**
 * Fetches right-hand documents directly by key: the ON clause equates the
 * right side's document key with a value computed from the left row.
 */
public final class LookupJoin extends JoinOperator {

    private final Expression keys;

    /**
     * Creates a lookup join.
     *
     * @param left the left input
     * @param right the fetch of the right-hand keyspace
     * @param alias the right-hand alias
     * @param onclause the ON clause
     * @param outer whether the join is outer
     * @param nest whether the join is a nest
     * @param keys the document keys to fetch, over the left side
     */
    public LookupJoin(PlanOperator left, PlanOperator right, String alias, Expression onclause,
                      boolean outer, boolean nest, Expression keys) {
        super(left, right, alias, onclause, outer, nest);
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
    }

    public Expression keys() {
        return keys;
    }

    @Override
    public String describe() {
        return String.format("Lookup%s(%s, keys=%s)", joinKeyword(), alias(), keys.toSQL());
    }
}
