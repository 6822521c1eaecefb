package com.sargasso.planner.sarg;

/**
 * Symbolic spans.
 */
public enum SentinelSpans implements SargSpans {
    /** Provably no rows. */
    EMPTY,
    /** Unconstrained: a full index scan. */
    FULL,
    /** Unconstrained, MISSING keys included. */
    WHOLE,
    /** A full index scan known to select exactly the rows of its predicate. */
    EXACT_FULL;

    @Override
    public int size() {
        return this == EMPTY ? 0 : 1;
    }

    @Override
    public boolean isExact() {
        return this == EMPTY || this == EXACT_FULL;
    }

    @Override
    public boolean canUseIndexOrder() {
        return true;
    }

    @Override
    public boolean canPushDownOffset() {
        return this == EXACT_FULL;
    }

    @Override
    public boolean canHaveDuplicates() {
        return false;
    }

    /**
     * Returns the concrete span this sentinel scans, or null for EMPTY.
     */
    public Span toSpan() {
        switch (this) {
            case FULL:
                return Span.of(KeyRange.full(), false);
            case WHOLE:
                return Span.of(KeyRange.full(), false);
            case EXACT_FULL:
                return Span.of(KeyRange.full(), true);
            default:
                return null;
        }
    }
}
