package com.sargasso.planner.sarg;

/**
 * Index access ranges derived from a predicate.
 *
 * <p>A closed algebra of immutable values: concrete {@link TermSpans}, the
 * conjunction {@link IntersectSpans} (an index intersection scan), the
 * disjunction {@link UnionSpans} (an index union scan) and the
 * {@link SentinelSpans}. Values are combined with {@link SpanAlgebra} and
 * streamlined once before they reach a scan operator.
 */
public sealed interface SargSpans permits TermSpans, IntersectSpans, UnionSpans, SentinelSpans {

    /**
     * Returns the number of spans a scan would iterate.
     */
    int size();

    /**
     * Returns whether the spans select exactly the rows of their predicate.
     */
    boolean isExact();

    /**
     * Returns whether a scan over these spans returns keys in index order.
     */
    boolean canUseIndexOrder();

    /**
     * Returns whether an OFFSET can be applied by the index scan itself.
     */
    boolean canPushDownOffset();

    /**
     * Returns whether a scan over these spans may return the same document twice.
     */
    boolean canHaveDuplicates();
}
