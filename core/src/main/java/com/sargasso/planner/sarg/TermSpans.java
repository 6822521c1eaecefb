package com.sargasso.planner.sarg;

import com.sargasso.expression.Literal;
import com.sargasso.value.Value;
import java.util.List;

/**
 * An ordered list of concrete spans over the leading keys of one index.
 *
 * @param spans the spans, in scan order
 */
public record TermSpans(List<Span> spans) implements SargSpans {

    /** {@code [TRUE, TRUE]}: the key is implied by the predicate. */
    public static final TermSpans SELF = single(KeyRange.point(Literal.TRUE), false);

    /** {@code [TRUE, TRUE]}: the key is the predicate. */
    public static final TermSpans EXACT_SELF = single(KeyRange.point(Literal.TRUE), true);

    /** Every key above NULL; the predicate is not fully applied. */
    public static final TermSpans VALUED = single(KeyRange.valued(), false);

    /** Every key above NULL; the predicate is exactly "is valued". */
    public static final TermSpans EXACT_VALUED = single(KeyRange.valued(), true);

    public TermSpans {
        spans = List.copyOf(spans);
    }

    public static TermSpans of(Span... spans) {
        return new TermSpans(List.of(spans));
    }

    public static TermSpans single(KeyRange range, boolean exact) {
        return new TermSpans(List.of(Span.of(range, exact)));
    }

    @Override
    public int size() {
        return spans.size();
    }

    @Override
    public boolean isExact() {
        for (Span span : spans) {
            if (!span.isExact()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean canUseIndexOrder() {
        return spans.size() == 1 || isOrderedDisjoint();
    }

    @Override
    public boolean canPushDownOffset() {
        return spans.size() == 1 && spans.get(0).isExact();
    }

    @Override
    public boolean canHaveDuplicates() {
        return spans.size() > 1 && !isOrderedDisjoint();
    }

    /**
     * Whether every span is one static range and each range ends before the
     * next one starts, as for an IN list or the two sides of a not-equal.
     */
    private boolean isOrderedDisjoint() {
        KeyRange previous = null;
        for (Span span : spans) {
            if (span.size() != 1) {
                return false;
            }
            KeyRange range = span.ranges().get(0);
            if (!range.isStatic()) {
                return false;
            }
            if (previous != null && !precedes(previous, range)) {
                return false;
            }
            previous = range;
        }
        return true;
    }

    private static boolean precedes(KeyRange first, KeyRange second) {
        if (first.high() == null || second.low() == null) {
            return false;
        }
        Value high = first.highValue().get();
        Value low = second.lowValue().get();
        int cmp = high.compareTo(low);
        return cmp < 0 || (cmp == 0 && !(first.inclusion().includesHigh() && second.inclusion().includesLow()));
    }

    @Override
    public String toString() {
        return "Term" + spans;
    }
}
