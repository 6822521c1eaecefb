package com.sargasso.plan;

import com.sargasso.catalog.Index;
import java.util.Objects;

/**
 * Full scan of a keyspace through its primary index.
 */
public final class PrimaryScan extends PlanOperator {

    private final String alias;
    private final Index index;

    public PrimaryScan(String alias, Index index) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
    }

    public String alias() {
        return alias;
    }

    public Index index() {
        return index;
    }

    @Override
    public String describe() {
        return String.format("PrimaryScan(%s, index=%s)", alias, index.name());
    }
}
