package com.sargasso.planner.sarg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A composite-key access range: one {@link KeyRange} per leading index key.
 *
 * <p>An exact span selects precisely the rows its predicate selects, so the
 * predicate need not be re-evaluated on the scanned keys.
 */
public final class Span {

    private final List<KeyRange> ranges;
    private final boolean exact;

    public Span(List<KeyRange> ranges, boolean exact) {
        this.ranges = List.copyOf(Objects.requireNonNull(ranges, "ranges must not be null"));
        this.exact = exact;
    }

    public static Span of(KeyRange range, boolean exact) {
        return new Span(Collections.singletonList(range), exact);
    }

    public List<KeyRange> ranges() {
        return ranges;
    }

    public boolean isExact() {
        return exact;
    }

    /**
     * Returns the number of key positions this span constrains.
     */
    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        for (KeyRange range : ranges) {
            if (range.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether every position is a single value.
     */
    public boolean isPoint() {
        for (KeyRange range : ranges) {
            if (!range.isPoint()) {
                return false;
            }
        }
        return !ranges.isEmpty();
    }

    /**
     * Appends the range of the next key position.
     *
     * @param next the range of the next key
     * @param nextExact whether the next range is exact
     * @return the longer span
     */
    public Span append(KeyRange next, boolean nextExact) {
        List<KeyRange> appended = new ArrayList<>(ranges);
        appended.add(next);
        return new Span(appended, exact && nextExact);
    }

    public Span withExact(boolean exact) {
        return this.exact == exact ? this : new Span(ranges, exact);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Span)) return false;
        Span other = (Span) obj;
        return exact == other.exact && ranges.equals(other.ranges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ranges, exact);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < ranges.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(ranges.get(i));
        }
        return sb.append(exact ? "}" : "}~").toString();
    }
}
