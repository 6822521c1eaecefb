package com.sargasso.planner.sarg;

import com.sargasso.expression.Expressions;
import com.sargasso.expression.Literal;
import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;
import com.sargasso.value.Value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the span algebra: streamlining, the absorption laws, composition
 * of composite keys, same-key constraints and selectivity estimates.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SpanAlgebra Tests")
public class SpanAlgebraTest extends TestBase {

    private static TermSpans point(int value) {
        return TermSpans.single(KeyRange.point(Value.of(value)), true);
    }

    private static TermSpans above(int value) {
        return TermSpans.single(KeyRange.above(Literal.of(value), false), true);
    }

    private static TermSpans below(int value) {
        return TermSpans.single(KeyRange.below(Literal.of(value), true), true);
    }

    private static TermSpans between(int low, int high) {
        return TermSpans.single(new KeyRange(Literal.of(low), Literal.of(high), Inclusion.BOTH), true);
    }

    static Stream<SargSpans> samples() {
        TermSpans emptyRange = TermSpans.single(new KeyRange(Literal.of(5), Literal.of(1), Inclusion.BOTH), true);
        return Stream.of(
            SentinelSpans.EMPTY,
            SentinelSpans.FULL,
            SentinelSpans.WHOLE,
            SentinelSpans.EXACT_FULL,
            point(1),
            emptyRange,
            TermSpans.of(Span.of(KeyRange.point(Value.of(1)), true), Span.of(KeyRange.point(Value.of(1)), true)),
            new IntersectSpans(List.of(point(1), new IntersectSpans(List.of(above(0), SentinelSpans.FULL)))),
            new UnionSpans(List.of(point(1), new UnionSpans(List.of(point(2), SentinelSpans.EMPTY)))),
            new UnionSpans(List.of(point(1), new IntersectSpans(List.of(above(3), below(9))))),
            new IntersectSpans(List.of(new UnionSpans(List.of(point(1), point(2))), SentinelSpans.WHOLE)),
            new UnionSpans(List.of(emptyRange, SentinelSpans.EMPTY)),
            new IntersectSpans(List.of(SentinelSpans.FULL, SentinelSpans.EXACT_FULL, SentinelSpans.WHOLE)));
    }

    // ==================== Streamline ====================

    @Nested
    @DisplayName("Streamline")
    class Streamline {

        @ParameterizedTest
        @MethodSource("com.sargasso.planner.sarg.SpanAlgebraTest#samples")
        @DisplayName("streamline is idempotent")
        void testIdempotent(SargSpans spans) {
            SargSpans once = SpanAlgebra.streamline(spans);
            SargSpans twice = SpanAlgebra.streamline(once);

            logData("streamlined", once);
            assertThat(twice).isEqualTo(once);
        }

        @Test
        @DisplayName("Nested intersections are flattened and FULL dropped")
        void testFlattenIntersect() {
            SargSpans spans = new IntersectSpans(List.of(point(1),
                new IntersectSpans(List.of(above(0), SentinelSpans.FULL))));

            SargSpans result = SpanAlgebra.streamline(spans);

            assertThat(result).isEqualTo(new IntersectSpans(List.of(point(1), above(0))));
        }

        @Test
        @DisplayName("Nested unions are flattened and EMPTY dropped")
        void testFlattenUnion() {
            SargSpans spans = new UnionSpans(List.of(point(1),
                new UnionSpans(List.of(point(2), SentinelSpans.EMPTY))));

            SargSpans result = SpanAlgebra.streamline(spans);

            assertThat(result).isEqualTo(new UnionSpans(List.of(point(1), point(2))));
        }

        @Test
        @DisplayName("A single remaining child replaces its parent")
        void testSingleChildCollapses() {
            SargSpans spans = new UnionSpans(List.of(point(7), SentinelSpans.EMPTY));

            assertThat(SpanAlgebra.streamline(spans)).isEqualTo(point(7));
        }

        @Test
        @DisplayName("Empty ranges are removed from a term and an empty term becomes EMPTY")
        void testEmptyRangesRemoved() {
            TermSpans spans = TermSpans.of(
                Span.of(new KeyRange(Literal.of(5), Literal.of(1), Inclusion.BOTH), true),
                Span.of(KeyRange.point(Value.of(3)), true));

            assertThat(SpanAlgebra.streamline(spans)).isEqualTo(point(3));
            assertThat(SpanAlgebra.streamline(
                TermSpans.single(new KeyRange(Literal.of(2), Literal.of(2), Inclusion.LOW), true)))
                .isEqualTo(SentinelSpans.EMPTY);
        }

        @Test
        @DisplayName("Duplicate spans are removed keeping the first occurrence")
        void testDuplicatesRemoved() {
            SargSpans spans = new UnionSpans(List.of(point(2), point(1), point(2)));

            assertThat(SpanAlgebra.streamline(spans)).isEqualTo(new UnionSpans(List.of(point(2), point(1))));
        }

        @Test
        @DisplayName("Unconstrained sentinels keep their precedence")
        void testSentinelPrecedence() {
            assertThat(SpanAlgebra.intersect(SentinelSpans.FULL, SentinelSpans.WHOLE, SentinelSpans.EXACT_FULL))
                .isEqualTo(SentinelSpans.EXACT_FULL);
            assertThat(SpanAlgebra.union(SentinelSpans.EXACT_FULL, SentinelSpans.WHOLE, SentinelSpans.FULL))
                .isEqualTo(SentinelSpans.FULL);
            assertThat(SpanAlgebra.union(SentinelSpans.EXACT_FULL, SentinelSpans.WHOLE))
                .isEqualTo(SentinelSpans.WHOLE);
        }
    }

    // ==================== Absorption ====================

    @Nested
    @DisplayName("Absorption Laws")
    class Absorption {

        @ParameterizedTest
        @MethodSource("com.sargasso.planner.sarg.SpanAlgebraTest#samples")
        @DisplayName("intersect(s, EMPTY) == EMPTY")
        void testIntersectEmpty(SargSpans spans) {
            assertThat(SpanAlgebra.intersect(spans, SentinelSpans.EMPTY)).isEqualTo(SentinelSpans.EMPTY);
        }

        @ParameterizedTest
        @MethodSource("com.sargasso.planner.sarg.SpanAlgebraTest#samples")
        @DisplayName("intersect(s, FULL) == streamline(s)")
        void testIntersectFull(SargSpans spans) {
            assertThat(SpanAlgebra.intersect(spans, SentinelSpans.FULL)).isEqualTo(SpanAlgebra.streamline(spans));
        }

        @ParameterizedTest
        @MethodSource("com.sargasso.planner.sarg.SpanAlgebraTest#samples")
        @DisplayName("union(s, FULL) == FULL")
        void testUnionFull(SargSpans spans) {
            assertThat(SpanAlgebra.union(spans, SentinelSpans.FULL)).isEqualTo(SentinelSpans.FULL);
        }

        @ParameterizedTest
        @MethodSource("com.sargasso.planner.sarg.SpanAlgebraTest#samples")
        @DisplayName("union(s, EMPTY) == streamline(s)")
        void testUnionEmpty(SargSpans spans) {
            assertThat(SpanAlgebra.union(spans, SentinelSpans.EMPTY)).isEqualTo(SpanAlgebra.streamline(spans));
        }
    }

    // ==================== Compose ====================

    @Nested
    @DisplayName("Composite Keys")
    class Compose {

        @Test
        @DisplayName("Points compose into one exact span per combination")
        void testPointProduct() {
            SargSpans prefix = TermSpans.of(Span.of(KeyRange.point(Value.of(1)), true),
                Span.of(KeyRange.point(Value.of(2)), true));

            SargSpans result = SpanAlgebra.compose(prefix, point(9), 8192);

            assertThat(result).isInstanceOf(TermSpans.class);
            TermSpans term = (TermSpans) result;
            assertThat(term.spans()).hasSize(2);
            assertThat(term.spans()).allSatisfy(span -> {
                assertThat(span.size()).isEqualTo(2);
                assertThat(span.isExact()).isTrue();
            });
            assertThat(term.spans().get(0).ranges().get(1).lowValue()).contains(Value.of(9));
        }

        @Test
        @DisplayName("A constraint after a range key is inexact")
        void testAfterRangeInexact() {
            SargSpans result = SpanAlgebra.compose(above(3), point(1), 8192);

            assertThat(result.isExact()).isFalse();
            assertThat(result.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Exceeding the fan-out leaves the next key unconstrained")
        void testFanoutLimit() {
            SargSpans prefix = TermSpans.of(Span.of(KeyRange.point(Value.of(1)), true),
                Span.of(KeyRange.point(Value.of(2)), true));
            SargSpans next = TermSpans.of(Span.of(KeyRange.point(Value.of(3)), true),
                Span.of(KeyRange.point(Value.of(4)), true));

            SargSpans result = SpanAlgebra.compose(prefix, next, 3);

            assertThat(result.size()).isEqualTo(2);
            assertThat(result.isExact()).isFalse();
            assertThat(((TermSpans) result).spans()).allSatisfy(span -> assertThat(span.size()).isEqualTo(1));
        }

        @Test
        @DisplayName("Composition distributes over a union prefix")
        void testDistributesOverUnion() {
            SargSpans prefix = new UnionSpans(List.of(point(1), point(3)));

            SargSpans result = SpanAlgebra.compose(prefix, point(2), 8192);

            assertThat(result).isInstanceOf(UnionSpans.class);
            assertThat(((UnionSpans) result).children()).hasSize(2);
        }

        @Test
        @DisplayName("EMPTY on either side yields EMPTY")
        void testEmpty() {
            assertThat(SpanAlgebra.compose(SentinelSpans.EMPTY, point(1), 8192)).isEqualTo(SentinelSpans.EMPTY);
            assertThat(SpanAlgebra.compose(point(1), SentinelSpans.EMPTY, 8192)).isEqualTo(SentinelSpans.EMPTY);
        }
    }

    // ==================== Constrain ====================

    @Nested
    @DisplayName("Same-Key Constraints")
    class Constrain {

        @Test
        @DisplayName("Static ranges intersect into one range")
        void testStaticRangesIntersect() {
            SargSpans result = SpanAlgebra.constrain(above(3), below(9));

            assertThat(result).isEqualTo(TermSpans.single(
                new KeyRange(Literal.of(3), Literal.of(9), Inclusion.HIGH), true));
        }

        @Test
        @DisplayName("Disjoint static ranges are EMPTY")
        void testDisjointIsEmpty() {
            assertThat(SpanAlgebra.constrain(point(1), point(2))).isEqualTo(SentinelSpans.EMPTY);
            assertThat(SpanAlgebra.constrain(above(9), below(3))).isEqualTo(SentinelSpans.EMPTY);
        }

        @Test
        @DisplayName("Ranges with runtime bounds become an intersection")
        void testRuntimeBoundsIntersect() {
            TermSpans runtime = TermSpans.single(KeyRange.point(Expressions.path("b", "k")), true);

            SargSpans result = SpanAlgebra.constrain(runtime, above(3));

            assertThat(result).isInstanceOf(IntersectSpans.class);
        }

        @Test
        @DisplayName("WHOLE makes the other side inexact")
        void testWholeMakesInexact() {
            SargSpans result = SpanAlgebra.constrain(SentinelSpans.WHOLE, point(1));

            assertThat(result.isExact()).isFalse();
            assertThat(result.size()).isEqualTo(1);
        }
    }

    // ==================== Capabilities ====================

    @Nested
    @DisplayName("Capabilities and Selectivity")
    class Capabilities {

        @Test
        @DisplayName("Only a single term can deliver index order")
        void testIndexOrder() {
            assertThat(point(1).canUseIndexOrder()).isTrue();
            assertThat(new UnionSpans(List.of(point(1), point(2))).canUseIndexOrder()).isFalse();
            assertThat(new IntersectSpans(List.of(point(1), above(0))).canUseIndexOrder()).isFalse();
        }

        @Test
        @DisplayName("Ordered disjoint ranges keep index order and never duplicate")
        void testOrderedDisjointRanges() {
            TermSpans disjoint = TermSpans.of(
                Span.of(KeyRange.below(Literal.of(3), false), true),
                Span.of(KeyRange.above(Literal.of(3), false), true));
            TermSpans separated = TermSpans.of(
                Span.of(new KeyRange(Literal.of(1), Literal.of(2), Inclusion.BOTH), true),
                Span.of(new KeyRange(Literal.of(5), Literal.of(9), Inclusion.BOTH), true));

            assertThat(disjoint.canUseIndexOrder()).isTrue();
            assertThat(disjoint.canHaveDuplicates()).isFalse();
            assertThat(separated.canUseIndexOrder()).isTrue();
            assertThat(separated.canHaveDuplicates()).isFalse();
        }

        @Test
        @DisplayName("Overlapping or unordered ranges may duplicate")
        void testOverlappingRanges() {
            TermSpans overlapping = TermSpans.of(
                Span.of(new KeyRange(Literal.of(1), Literal.of(5), Inclusion.BOTH), true),
                Span.of(new KeyRange(Literal.of(5), Literal.of(9), Inclusion.BOTH), true));
            TermSpans unordered = TermSpans.of(
                Span.of(KeyRange.point(Value.of(7)), true),
                Span.of(KeyRange.point(Value.of(2)), true));
            TermSpans unbounded = TermSpans.of(
                Span.of(KeyRange.above(Literal.of(3), false), true),
                Span.of(KeyRange.point(Value.of(9)), true));

            assertThat(overlapping.canHaveDuplicates()).isTrue();
            assertThat(overlapping.canUseIndexOrder()).isFalse();
            assertThat(unordered.canHaveDuplicates()).isTrue();
            assertThat(unbounded.canHaveDuplicates()).isTrue();
        }

        @Test
        @DisplayName("Selectivity multiplies for intersections and complements for unions")
        void testSelectivity() {
            double p = SpanAlgebra.estimateSelectivity(point(1));
            double r = SpanAlgebra.estimateSelectivity(between(1, 5));
            double h = SpanAlgebra.estimateSelectivity(above(1));

            assertThat(p).isEqualTo(SpanAlgebra.POINT_SELECTIVITY);
            assertThat(r).isEqualTo(SpanAlgebra.RANGE_SELECTIVITY);
            assertThat(h).isEqualTo(SpanAlgebra.HALF_RANGE_SELECTIVITY);
            assertThat(SpanAlgebra.estimateSelectivity(new IntersectSpans(List.of(point(1), above(1)))))
                .isCloseTo(p * h, within(1e-9));
            assertThat(SpanAlgebra.estimateSelectivity(new UnionSpans(List.of(point(1), above(1)))))
                .isCloseTo(1 - (1 - p) * (1 - h), within(1e-9));
            assertThat(SpanAlgebra.estimateSelectivity(SentinelSpans.EMPTY)).isZero();
            assertThat(SpanAlgebra.estimateSelectivity(SentinelSpans.FULL)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Valued range counts as unbounded")
        void testValuedUnbounded() {
            assertThat(SpanAlgebra.estimateSelectivity(TermSpans.VALUED)).isEqualTo(1.0);
        }
    }
}
