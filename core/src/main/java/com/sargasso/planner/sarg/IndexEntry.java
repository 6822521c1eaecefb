package com.sargasso.planner.sarg;

import com.sargasso.catalog.Index;
import com.sargasso.catalog.IndexKey;
import com.sargasso.cost.Cost;
import com.sargasso.expression.Expression;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * A candidate index for one keyspace, with the keys the predicate matched and
 * the resulting spans. Lives for one scan-building step.
 */
public final class IndexEntry {

    /**
     * Why and how the index matched.
     */
    public enum Flag {
        /** The index has an array key; a scan may return a document more than once. */
        ARRAY_INDEX,
        /** The index has a condition implied by the predicate. */
        PARTIAL,
        /** The spans select exactly the rows of the predicate. */
        EXACT_SPANS,
        /** The scan returns keys in index order. */
        INDEX_ORDER,
        /** OFFSET can be applied by the scan. */
        PUSHDOWN_OFFSET,
        /** The index holds every field the statement needs from the keyspace. */
        COVERING
    }

    private final Index index;
    private final List<IndexKey> keys;
    private final int sargKeys;
    private final SargSpans spans;
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private double selectivity;
    private Cost cost = Cost.NOT_AVAILABLE;

    /**
     * Creates an entry.
     *
     * @param index the index
     * @param keys the index keys formalized to the scanned alias
     * @param sargKeys the number of leading keys the predicate constrains
     * @param spans the streamlined spans
     */
    public IndexEntry(Index index, List<IndexKey> keys, int sargKeys, SargSpans spans) {
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.keys = List.copyOf(keys);
        this.sargKeys = sargKeys;
        this.spans = Objects.requireNonNull(spans, "spans must not be null");
        this.selectivity = SpanAlgebra.estimateSelectivity(spans);
        if (index.hasArrayKey()) {
            flags.add(Flag.ARRAY_INDEX);
        }
        if (index.condition() != null) {
            flags.add(Flag.PARTIAL);
        }
        if (spans.isExact()) {
            flags.add(Flag.EXACT_SPANS);
        }
        if (spans.canUseIndexOrder()) {
            flags.add(Flag.INDEX_ORDER);
        }
        if (spans.canPushDownOffset() && !index.hasArrayKey()) {
            flags.add(Flag.PUSHDOWN_OFFSET);
        }
    }

    public Index index() {
        return index;
    }

    public String name() {
        return index.name();
    }

    public List<IndexKey> keys() {
        return keys;
    }

    public int sargKeys() {
        return sargKeys;
    }

    /**
     * Returns the expressions of the matched leading keys.
     */
    public List<Expression> sargKeyExpressions() {
        List<Expression> result = new ArrayList<>(sargKeys);
        for (int i = 0; i < sargKeys; i++) {
            result.add(keys.get(i).expression());
        }
        return result;
    }

    public SargSpans spans() {
        return spans;
    }

    public boolean hasFlag(Flag flag) {
        return flags.contains(flag);
    }

    public void setFlag(Flag flag) {
        flags.add(flag);
    }

    /**
     * Returns whether a scan may return the same document more than once.
     */
    public boolean canHaveDuplicates() {
        return spans.canHaveDuplicates() || flags.contains(Flag.ARRAY_INDEX);
    }

    public double selectivity() {
        return selectivity;
    }

    public void setSelectivity(double selectivity) {
        this.selectivity = selectivity;
    }

    public Cost cost() {
        return cost;
    }

    public void setCost(Cost cost) {
        this.cost = Objects.requireNonNull(cost, "cost must not be null");
    }

    @Override
    public String toString() {
        return String.format("IndexEntry(%s, sargKeys=%d, spans=%s, flags=%s)", index.name(), sargKeys, spans, flags);
    }
}
