package com.sargasso.planner.sarg;

import com.sargasso.expression.Literal;
import com.sargasso.value.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Operations of the span algebra.
 *
 * <p>Laws, for every value {@code s}:
 * <pre>
 *   intersect(s, EMPTY) == EMPTY        union(s, FULL)  == FULL
 *   intersect(s, FULL)  == streamline(s) union(s, EMPTY) == streamline(s)
 *   streamline(streamline(s)) == streamline(s)
 * </pre>
 * In an intersection the unconstrained sentinels are identities; when nothing
 * else remains the strongest one is kept, EXACT_FULL over WHOLE over FULL. In a
 * union they absorb, FULL over WHOLE over EXACT_FULL.
 */
public final class SpanAlgebra {

    static final double POINT_SELECTIVITY = 0.05;
    static final double RANGE_SELECTIVITY = 0.25;
    static final double HALF_RANGE_SELECTIVITY = 0.5;

    private SpanAlgebra() {} // Utility class

    // ==================== Streamline ====================

    /**
     * Normalizes spans: flattens nested intersections and unions of the same
     * kind, drops neutral sentinels and empty spans, removes duplicates and
     * collapses to a sentinel when the result is provably empty or unconstrained.
     *
     * @param spans the spans
     * @return the streamlined spans
     */
    public static SargSpans streamline(SargSpans spans) {
        if (spans instanceof SentinelSpans) {
            return spans;
        }
        if (spans instanceof TermSpans) {
            return streamlineTerm((TermSpans) spans);
        }
        if (spans instanceof IntersectSpans) {
            return streamlineIntersect(((IntersectSpans) spans).children());
        }
        return streamlineUnion(((UnionSpans) spans).children());
    }

    private static SargSpans streamlineTerm(TermSpans term) {
        Set<Span> kept = new LinkedHashSet<>();
        for (Span span : term.spans()) {
            if (!span.isEmpty()) {
                kept.add(span);
            }
        }
        if (kept.isEmpty()) {
            return SentinelSpans.EMPTY;
        }
        if (kept.size() == term.spans().size()) {
            return term;
        }
        return new TermSpans(new ArrayList<>(kept));
    }

    private static SargSpans streamlineIntersect(List<SargSpans> children) {
        Set<SargSpans> kept = new LinkedHashSet<>();
        SentinelSpans identity = null;
        for (SargSpans child : children) {
            SargSpans streamlined = streamline(child);
            if (streamlined == SentinelSpans.EMPTY) {
                return SentinelSpans.EMPTY;
            }
            if (streamlined instanceof SentinelSpans) {
                identity = strongerIdentity(identity, (SentinelSpans) streamlined);
            } else if (streamlined instanceof IntersectSpans) {
                kept.addAll(((IntersectSpans) streamlined).children());
            } else {
                kept.add(streamlined);
            }
        }
        if (kept.isEmpty()) {
            return identity != null ? identity : SentinelSpans.FULL;
        }
        if (kept.size() == 1) {
            return kept.iterator().next();
        }
        return new IntersectSpans(new ArrayList<>(kept));
    }

    private static SentinelSpans strongerIdentity(SentinelSpans current, SentinelSpans candidate) {
        if (current == null) {
            return candidate;
        }
        return rank(candidate, SentinelSpans.FULL, SentinelSpans.WHOLE, SentinelSpans.EXACT_FULL)
            > rank(current, SentinelSpans.FULL, SentinelSpans.WHOLE, SentinelSpans.EXACT_FULL)
            ? candidate : current;
    }

    private static SargSpans streamlineUnion(List<SargSpans> children) {
        Set<SargSpans> kept = new LinkedHashSet<>();
        SentinelSpans absorbing = null;
        for (SargSpans child : children) {
            SargSpans streamlined = streamline(child);
            if (streamlined == SentinelSpans.EMPTY) {
                continue;
            }
            if (streamlined instanceof SentinelSpans) {
                absorbing = strongerAbsorbing(absorbing, (SentinelSpans) streamlined);
            } else if (streamlined instanceof UnionSpans) {
                kept.addAll(((UnionSpans) streamlined).children());
            } else {
                kept.add(streamlined);
            }
        }
        if (absorbing != null) {
            return absorbing;
        }
        if (kept.isEmpty()) {
            return SentinelSpans.EMPTY;
        }
        if (kept.size() == 1) {
            return kept.iterator().next();
        }
        return new UnionSpans(new ArrayList<>(kept));
    }

    private static SentinelSpans strongerAbsorbing(SentinelSpans current, SentinelSpans candidate) {
        if (current == null) {
            return candidate;
        }
        return rank(candidate, SentinelSpans.EXACT_FULL, SentinelSpans.WHOLE, SentinelSpans.FULL)
            > rank(current, SentinelSpans.EXACT_FULL, SentinelSpans.WHOLE, SentinelSpans.FULL)
            ? candidate : current;
    }

    private static int rank(SentinelSpans sentinel, SentinelSpans... ascending) {
        return Arrays.asList(ascending).indexOf(sentinel);
    }

    // ==================== Intersect / Union ====================

    public static SargSpans intersect(SargSpans... spans) {
        return intersect(Arrays.asList(spans));
    }

    /**
     * Intersects spans from independent AND-ed fragments or indexes.
     *
     * @param spans the spans
     * @return the streamlined intersection
     */
    public static SargSpans intersect(List<SargSpans> spans) {
        return streamlineIntersect(spans);
    }

    public static SargSpans union(SargSpans... spans) {
        return union(Arrays.asList(spans));
    }

    /**
     * Unites spans from OR-ed fragments.
     *
     * @param spans the spans
     * @return the streamlined union
     */
    public static SargSpans union(List<SargSpans> spans) {
        return streamlineUnion(spans);
    }

    // ==================== Sequence composition ====================

    /**
     * Narrows the spans of the leading keys by the spans of the next key.
     *
     * <p>Every prefix span is combined with every range of the next key. When the
     * product would exceed the fan-out limit the next key is left unconstrained
     * and the prefix becomes inexact.
     *
     * @param prefix spans over keys {@code 0..i-1}
     * @param next spans over key {@code i} alone
     * @param fanout the most spans the result may have
     * @return spans over keys {@code 0..i}
     */
    public static SargSpans compose(SargSpans prefix, SargSpans next, int fanout) {
        if (prefix == SentinelSpans.EMPTY || next == SentinelSpans.EMPTY) {
            return SentinelSpans.EMPTY;
        }
        if (prefix instanceof UnionSpans) {
            List<SargSpans> composed = new ArrayList<>();
            for (SargSpans child : ((UnionSpans) prefix).children()) {
                composed.add(compose(child, next, fanout));
            }
            return union(composed);
        }
        if (prefix instanceof IntersectSpans) {
            List<SargSpans> composed = new ArrayList<>();
            for (SargSpans child : ((IntersectSpans) prefix).children()) {
                composed.add(compose(child, next, fanout));
            }
            return intersect(composed);
        }
        if (next instanceof UnionSpans) {
            List<SargSpans> composed = new ArrayList<>();
            for (SargSpans child : ((UnionSpans) next).children()) {
                composed.add(compose(prefix, child, fanout));
            }
            return union(composed);
        }
        if (next instanceof IntersectSpans) {
            List<SargSpans> composed = new ArrayList<>();
            for (SargSpans child : ((IntersectSpans) next).children()) {
                composed.add(compose(prefix, child, fanout));
            }
            return intersect(composed);
        }

        List<Span> prefixSpans = spansOf(prefix);
        List<Span> nextSpans = spansOf(next);
        if ((long) prefixSpans.size() * nextSpans.size() > fanout) {
            return inexact(new TermSpans(prefixSpans));
        }
        List<Span> composed = new ArrayList<>(prefixSpans.size() * nextSpans.size());
        for (Span head : prefixSpans) {
            for (Span tail : nextSpans) {
                KeyRange range = tail.ranges().get(0);
                // a constraint after a non-point key only narrows the scan's end points
                boolean exact = tail.isExact() && (range.isFull() || head.isPoint());
                composed.add(head.append(range, exact));
            }
        }
        return streamlineTerm(new TermSpans(composed));
    }

    private static List<Span> spansOf(SargSpans spans) {
        if (spans instanceof TermSpans) {
            return ((TermSpans) spans).spans();
        }
        return List.of(((SentinelSpans) spans).toSpan());
    }

    // ==================== Constrain ====================

    /**
     * Combines two AND-ed conditions on the same single key.
     *
     * <p>Ranges known at planning time are intersected pairwise; otherwise the
     * two conditions become an intersection.
     *
     * @param first spans over the key
     * @param second spans over the same key
     * @return the combined spans
     */
    public static SargSpans constrain(SargSpans first, SargSpans second) {
        if (first == SentinelSpans.EMPTY || second == SentinelSpans.EMPTY) {
            return SentinelSpans.EMPTY;
        }
        if (first == SentinelSpans.FULL || first == SentinelSpans.EXACT_FULL) {
            return second;
        }
        if (second == SentinelSpans.FULL || second == SentinelSpans.EXACT_FULL) {
            return first;
        }
        if (first == SentinelSpans.WHOLE) {
            return inexact(second);
        }
        if (second == SentinelSpans.WHOLE) {
            return inexact(first);
        }
        if (first instanceof TermSpans && second instanceof TermSpans) {
            TermSpans a = (TermSpans) first;
            TermSpans b = (TermSpans) second;
            if (a.equals(b)) {
                return a;
            }
            if (isStatic(a) && isStatic(b)) {
                List<Span> combined = new ArrayList<>();
                for (Span x : a.spans()) {
                    for (Span y : b.spans()) {
                        combined.add(Span.of(intersectRange(x.ranges().get(0), y.ranges().get(0)),
                            x.isExact() && y.isExact()));
                    }
                }
                return streamlineTerm(new TermSpans(combined));
            }
        }
        return intersect(first, second);
    }

    private static boolean isStatic(TermSpans term) {
        for (Span span : term.spans()) {
            if (span.size() != 1 || !span.ranges().get(0).isStatic()) {
                return false;
            }
        }
        return true;
    }

    private static KeyRange intersectRange(KeyRange x, KeyRange y) {
        boolean lowFromX;
        boolean lowInclusive;
        if (x.low() == null || y.low() == null) {
            lowFromX = y.low() == null;
            lowInclusive = lowFromX ? x.inclusion().includesLow() : y.inclusion().includesLow();
        } else {
            int cmp = value(x.lowValue()).compareTo(value(y.lowValue()));
            lowFromX = cmp >= 0;
            lowInclusive = cmp == 0
                ? x.inclusion().includesLow() && y.inclusion().includesLow()
                : (lowFromX ? x.inclusion().includesLow() : y.inclusion().includesLow());
        }
        boolean highFromX;
        boolean highInclusive;
        if (x.high() == null || y.high() == null) {
            highFromX = y.high() == null;
            highInclusive = highFromX ? x.inclusion().includesHigh() : y.inclusion().includesHigh();
        } else {
            int cmp = value(x.highValue()).compareTo(value(y.highValue()));
            highFromX = cmp <= 0;
            highInclusive = cmp == 0
                ? x.inclusion().includesHigh() && y.inclusion().includesHigh()
                : (highFromX ? x.inclusion().includesHigh() : y.inclusion().includesHigh());
        }
        return new KeyRange(lowFromX ? x.low() : y.low(),
            highFromX ? x.high() : y.high(),
            Inclusion.of(lowInclusive, highInclusive));
    }

    private static Value value(Optional<Value> value) {
        return value.orElseThrow(() -> new IllegalStateException("Range bound is not static"));
    }

    /**
     * Marks spans inexact: the predicate they came from must be re-applied.
     *
     * @param spans the spans
     * @return the inexact spans
     */
    public static SargSpans inexact(SargSpans spans) {
        if (spans instanceof TermSpans) {
            List<Span> marked = new ArrayList<>();
            for (Span span : ((TermSpans) spans).spans()) {
                marked.add(span.withExact(false));
            }
            return new TermSpans(marked);
        }
        if (spans instanceof IntersectSpans) {
            List<SargSpans> marked = new ArrayList<>();
            for (SargSpans child : ((IntersectSpans) spans).children()) {
                marked.add(inexact(child));
            }
            return new IntersectSpans(marked);
        }
        if (spans instanceof UnionSpans) {
            List<SargSpans> marked = new ArrayList<>();
            for (SargSpans child : ((UnionSpans) spans).children()) {
                marked.add(inexact(child));
            }
            return new UnionSpans(marked);
        }
        return spans == SentinelSpans.EXACT_FULL ? SentinelSpans.FULL : spans;
    }

    // ==================== Selectivity ====================

    /**
     * Estimates the fraction of index entries the spans select, from a fixed
     * per-range heuristic.
     */
    public static double estimateSelectivity(SargSpans spans) {
        return estimateSelectivity(spans, SpanAlgebra::defaultSelectivity);
    }

    /**
     * Estimates the fraction of index entries the spans select: a sum clamped to
     * 1 for the spans of a term, a product for an intersection and
     * {@code 1 - prod(1 - s)} for a union.
     *
     * @param spans the spans
     * @param spanSelectivity the selectivity of one concrete span
     * @return a value in {@code [0, 1]}
     */
    public static double estimateSelectivity(SargSpans spans, ToDoubleFunction<Span> spanSelectivity) {
        if (spans == SentinelSpans.EMPTY) {
            return 0.0;
        }
        if (spans instanceof SentinelSpans) {
            return 1.0;
        }
        if (spans instanceof TermSpans) {
            double sum = 0.0;
            for (Span span : ((TermSpans) spans).spans()) {
                sum += spanSelectivity.applyAsDouble(span);
            }
            return Math.min(1.0, sum);
        }
        if (spans instanceof IntersectSpans) {
            double product = 1.0;
            for (SargSpans child : ((IntersectSpans) spans).children()) {
                product *= estimateSelectivity(child, spanSelectivity);
            }
            return product;
        }
        double miss = 1.0;
        for (SargSpans child : ((UnionSpans) spans).children()) {
            miss *= 1.0 - estimateSelectivity(child, spanSelectivity);
        }
        return 1.0 - miss;
    }

    static double defaultSelectivity(Span span) {
        double selectivity = 1.0;
        for (KeyRange range : span.ranges()) {
            boolean lowBounded = range.low() != null && !range.low().equals(Literal.NULL);
            boolean highBounded = range.high() != null;
            if (range.isPoint()) {
                selectivity *= POINT_SELECTIVITY;
            } else if (lowBounded && highBounded) {
                selectivity *= RANGE_SELECTIVITY;
            } else if (lowBounded || highBounded) {
                selectivity *= HALF_RANGE_SELECTIVITY;
            }
        }
        return selectivity;
    }
}
