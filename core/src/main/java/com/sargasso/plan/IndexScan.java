package com.sargasso.plan;

import com.sargasso.catalog.Index;
import com.sargasso.planner.sarg.SargSpans;
import java.util.Objects;

/**
 * Range scan of a secondary index.
 *
 * <p>A covering scan reads every value the statement needs from the index, so
 * no fetch follows it.
 */
public final class IndexScan extends PlanOperator {

    private final String alias;
    private final Index index;
    private final SargSpans spans;
    private final boolean covering;

    /**
     * Creates an index scan.
     *
     * @param alias the scanned alias
     * @param index the index
     * @param spans the streamlined spans, a term or a sentinel
     * @param covering whether the index covers the statement
     */
    public IndexScan(String alias, Index index, SargSpans spans, boolean covering) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.spans = Objects.requireNonNull(spans, "spans must not be null");
        this.covering = covering;
    }

    public String alias() {
        return alias;
    }

    public Index index() {
        return index;
    }

    public SargSpans spans() {
        return spans;
    }

    public boolean isCovering() {
        return covering;
    }

    @Override
    public String describe() {
        return String.format("IndexScan(%s, index=%s, spans=%s%s)",
            alias, index.name(), spans, covering ? ", covering" : "");
    }
}
