package com.sargasso.planner.sarg;

import com.sargasso.catalog.IndexKey;
import com.sargasso.expression.ArrayConstruct;
import com.sargasso.expression.Between;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Formalizer;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.In;
import com.sargasso.expression.IsExpression;
import com.sargasso.expression.Like;
import com.sargasso.expression.Literal;
import com.sargasso.expression.Not;
import com.sargasso.expression.Parameter;
import com.sargasso.expression.Quantified;
import com.sargasso.expression.Subquery;
import com.sargasso.expression.Within;
import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;
import com.sargasso.value.Value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for single-key sargability.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("KeySarger Tests")
public class KeySargerTest extends TestBase {

    private static final int FANOUT = 8192;

    private static final Expression X = Expressions.path("a", "x");

    private static KeySarger sarger() {
        return new KeySarger(IndexKey.of(Formalizer.key("x")).formalize("a"), "a", false, FANOUT);
    }

    private static List<Value> points(SargSpans spans) {
        assertThat(spans).isInstanceOf(TermSpans.class);
        List<Value> values = new ArrayList<>();
        for (Span span : ((TermSpans) spans).spans()) {
            assertThat(span.isPoint()).isTrue();
            values.add(span.ranges().get(0).lowValue().orElseThrow());
        }
        return values;
    }

    private static KeyRange onlyRange(SargSpans spans) {
        assertThat(spans).isInstanceOf(TermSpans.class);
        assertThat(spans.size()).isEqualTo(1);
        return ((TermSpans) spans).spans().get(0).ranges().get(0);
    }

    // ==================== Comparisons ====================

    @Nested
    @DisplayName("Comparisons")
    class Comparisons {

        @Test
        @DisplayName("Equality gives an exact point")
        void testEquality() {
            SargSpans spans = sarger().sarg(Comparison.eq(X, Literal.of(10)));

            assertThat(points(spans)).containsExactly(Value.of(10));
            assertThat(spans.isExact()).isTrue();
        }

        @Test
        @DisplayName("Mirrored comparison bounds the key from the right side")
        void testMirrored() {
            KeyRange range = onlyRange(sarger().sarg(Comparison.lt(Literal.of(5), X)));

            assertThat(range.lowValue()).contains(Value.of(5));
            assertThat(range.high()).isNull();
            assertThat(range.inclusion()).isEqualTo(Inclusion.NEITHER);
        }

        @Test
        @DisplayName("Upper bounds start above NULL")
        void testUpperBound() {
            KeyRange range = onlyRange(sarger().sarg(Comparison.le(X, Literal.of(5))));

            assertThat(range.low()).isEqualTo(Literal.NULL);
            assertThat(range.highValue()).contains(Value.of(5));
            assertThat(range.inclusion()).isEqualTo(Inclusion.HIGH);
        }

        @Test
        @DisplayName("Inequality gives two open ranges")
        void testNotEqual() {
            SargSpans spans = sarger().sarg(Comparison.ne(X, Literal.of(5)));

            assertThat(spans.size()).isEqualTo(2);
            assertThat(spans.canHaveDuplicates()).isFalse();
            assertThat(spans.canUseIndexOrder()).isTrue();
        }

        @Test
        @DisplayName("Comparing with NULL selects nothing")
        void testNullBound() {
            assertThat(sarger().sarg(Comparison.eq(X, Literal.NULL))).isEqualTo(SentinelSpans.EMPTY);
        }

        @Test
        @DisplayName("Parameters are bounds, other keyspaces are not outside a join")
        void testBoundness() {
            SargSpans param = sarger().sarg(Comparison.eq(X, new Parameter("p")));
            SargSpans other = sarger().sarg(Comparison.eq(X, Expressions.path("b", "k")));

            assertThat(param.size()).isEqualTo(1);
            assertThat(other).isEqualTo(TermSpans.VALUED);
        }

        @Test
        @DisplayName("Under a nested-loop join an outer keyspace bounds the key")
        void testJoinBound() {
            KeySarger joinSarger = new KeySarger(IndexKey.of(Formalizer.key("x")).formalize("a"), "a", true, FANOUT);

            SargSpans spans = joinSarger.sarg(Comparison.eq(X, Expressions.path("b", "k")));

            assertThat(onlyRange(spans).isPoint()).isTrue();
            assertThat(onlyRange(spans).low()).isEqualTo(Expressions.path("b", "k"));
        }

        @Test
        @DisplayName("A bound referring to the scanned keyspace itself is not usable")
        void testSelfReference() {
            KeySarger joinSarger = new KeySarger(IndexKey.of(Formalizer.key("x")).formalize("a"), "a", true, FANOUT);

            assertThat(joinSarger.sarg(Comparison.eq(X, Expressions.path("a", "y"))))
                .isEqualTo(TermSpans.VALUED);
        }

        @Test
        @DisplayName("Subquery bounds are not usable")
        void testSubqueryBound() {
            SargSpans spans = sarger().sarg(Comparison.eq(X, Subquery.uncorrelated("SELECT RAW 1")));

            assertThat(spans).isEqualTo(TermSpans.VALUED);
        }

        @Test
        @DisplayName("Unrelated predicates return null")
        void testUnrelated() {
            assertThat(sarger().sarg(Comparison.eq(Expressions.path("a", "y"), Literal.of(1)))).isNull();
        }

        @Test
        @DisplayName("Negated comparison on the key still requires a value")
        void testNegation() {
            assertThat(sarger().sarg(new Not(Comparison.eq(X, Literal.of(1))))).isEqualTo(TermSpans.VALUED);
        }
    }

    // ==================== BETWEEN / LIKE ====================

    @Nested
    @DisplayName("BETWEEN and LIKE")
    class RangesAndPatterns {

        @Test
        @DisplayName("BETWEEN gives a closed range")
        void testBetween() {
            KeyRange range = onlyRange(sarger().sarg(new Between(X, Literal.of(1), Literal.of(9))));

            assertThat(range.inclusion()).isEqualTo(Inclusion.BOTH);
            assertThat(range.lowValue()).contains(Value.of(1));
            assertThat(range.highValue()).contains(Value.of(9));
        }

        @Test
        @DisplayName("Inverted BETWEEN selects nothing")
        void testInvertedBetween() {
            assertThat(sarger().sarg(new Between(X, Literal.of(9), Literal.of(1)))).isEqualTo(SentinelSpans.EMPTY);
        }

        @Test
        @DisplayName("LIKE with a trailing wildcard scans the prefix range exactly")
        void testLikePrefix() {
            SargSpans spans = sarger().sarg(Like.like(X, Literal.of("ab%")));
            KeyRange range = onlyRange(spans);

            assertThat(range.lowValue()).contains(Value.of("ab"));
            assertThat(range.highValue()).contains(Value.of("ac"));
            assertThat(range.inclusion()).isEqualTo(Inclusion.LOW);
            assertThat(spans.isExact()).isTrue();
        }

        @Test
        @DisplayName("LIKE with an inner wildcard scans the prefix range inexactly")
        void testLikeInnerWildcard() {
            SargSpans spans = sarger().sarg(Like.like(X, Literal.of("ab_d")));

            assertThat(onlyRange(spans).lowValue()).contains(Value.of("ab"));
            assertThat(spans.isExact()).isFalse();
        }

        @Test
        @DisplayName("LIKE without wildcards is a point")
        void testLikeLiteral() {
            assertThat(points(sarger().sarg(Like.like(X, Literal.of("abc"))))).containsExactly(Value.of("abc"));
        }

        @Test
        @DisplayName("LIKE with a leading wildcard needs any valued key")
        void testLikeLeadingWildcard() {
            assertThat(sarger().sarg(Like.like(X, Literal.of("%b")))).isEqualTo(TermSpans.VALUED);
        }

        @Test
        @DisplayName("Regular expression prefix stops before a quantified character")
        void testRegexPrefix() {
            KeyRange range = onlyRange(sarger().sarg(Like.regexpLike(X, Literal.of("abc*"))));

            assertThat(range.lowValue()).contains(Value.of("ab"));
        }

        @Test
        @DisplayName("Prefix successor increments the last character")
        void testSuccessor() {
            assertThat(KeySarger.successor("ab")).isEqualTo(Value.of("ac"));
            assertThat(KeySarger.successor("a" + Character.MAX_VALUE)).isEqualTo(Value.of("b"));
        }

        @Test
        @DisplayName("LIKE prefix of only the largest character runs up to the arrays")
        void testLikePrefixWithoutSuccessor() {
            String prefix = "\uFFFF\uFFFF";
            SargSpans spans = sarger().sarg(Like.like(X, Literal.of(prefix + "%")));
            KeyRange range = onlyRange(spans);

            assertThat(range.lowValue()).contains(Value.of(prefix));
            assertThat(range.highValue()).contains(Value.of(List.of()));
            assertThat(range.inclusion()).isEqualTo(Inclusion.LOW);
            assertThat(Value.of(prefix + "\uFFFFz").compareTo(range.highValue().get())).isNegative();
            assertThat(spans.isExact()).isTrue();
        }
    }

    // ==================== IN / WITHIN ====================

    @Nested
    @DisplayName("IN and WITHIN")
    class Collections {

        @Test
        @DisplayName("IN list gives sorted distinct points")
        void testInListSortedDistinct() {
            SargSpans spans = sarger().sarg(new In(X, Literal.of(List.of(3, 1, 2, 1))));

            assertThat(points(spans)).containsExactly(Value.of(1), Value.of(2), Value.of(3));
            assertThat(spans.isExact()).isTrue();
            assertThat(spans.canHaveDuplicates()).isFalse();
            assertThat(spans.canUseIndexOrder()).isTrue();
        }

        @Test
        @DisplayName("IN list spans are stable across runs and input orders")
        void testInListDeterministic() {
            SargSpans first = sarger().sarg(new In(X, Literal.of(List.of("c", "a", 2, "b", 2, "a"))));
            SargSpans second = sarger().sarg(new In(X, Literal.of(List.of(2, "b", "c", "a"))));
            SargSpans third = sarger().sarg(new In(X, Literal.of(List.of("c", "a", 2, "b", 2, "a"))));

            assertThat(points(first)).containsExactly(Value.of(2), Value.of("a"), Value.of("b"), Value.of("c"));
            assertThat(first).isEqualTo(second).isEqualTo(third);
        }

        @Test
        @DisplayName("NULL and MISSING elements are dropped from IN lists")
        void testInListUnknownElements() {
            List<Object> values = new ArrayList<>();
            values.add(null);
            values.add(4);
            SargSpans spans = sarger().sarg(new In(X, Literal.of(values)));

            assertThat(points(spans)).containsExactly(Value.of(4));
        }

        @Test
        @DisplayName("Empty IN list needs any valued key")
        void testEmptyInList() {
            assertThat(sarger().sarg(new In(X, Literal.of(List.of())))).isEqualTo(TermSpans.VALUED);
        }

        @Test
        @DisplayName("IN list above the fan-out becomes one inexact range")
        void testInListFanout() {
            KeySarger small = new KeySarger(IndexKey.of(Formalizer.key("x")).formalize("a"), "a", false, 2);

            SargSpans spans = small.sarg(new In(X, Literal.of(List.of(5, 1, 3))));
            KeyRange range = onlyRange(spans);

            assertThat(range.lowValue()).contains(Value.of(1));
            assertThat(range.highValue()).contains(Value.of(5));
            assertThat(spans.isExact()).isFalse();
        }

        @Test
        @DisplayName("IN over runtime elements keeps written order")
        void testInRuntimeElements() {
            SargSpans spans = sarger().sarg(new In(X, new ArrayConstruct(new Parameter("p"), new Parameter("q"))));

            assertThat(spans.size()).isEqualTo(2);
            assertThat(((TermSpans) spans).spans().get(0).ranges().get(0).low()).isEqualTo(new Parameter("p"));
        }

        @Test
        @DisplayName("WITHIN over scalars gives sorted points")
        void testWithinScalars() {
            SargSpans spans = sarger().sarg(new Within(X, Literal.of(List.of(3, 1, 2, 3))));

            assertThat(points(spans)).containsExactly(Value.of(1), Value.of(2), Value.of(3));
        }

        @Test
        @DisplayName("WITHIN with nested containers needs any valued key")
        void testWithinNested() {
            SargSpans spans = sarger().sarg(new Within(X, Literal.of(List.of(3, List.of(1, 2)))));

            assertThat(spans).isEqualTo(TermSpans.VALUED);
        }
    }

    // ==================== IS / array keys ====================

    @Nested
    @DisplayName("IS Predicates and Array Keys")
    class IsAndArrays {

        @Test
        @DisplayName("IS forms map to their spans")
        void testIsForms() {
            assertThat(points(sarger().sarg(new IsExpression(IsExpression.Kind.NULL, X))))
                .containsExactly(Value.NULL);
            assertThat(sarger().sarg(new IsExpression(IsExpression.Kind.NOT_NULL, X)))
                .isEqualTo(TermSpans.EXACT_VALUED);
            assertThat(sarger().sarg(new IsExpression(IsExpression.Kind.VALUED, X)))
                .isEqualTo(TermSpans.EXACT_VALUED);
            assertThat(sarger().sarg(new IsExpression(IsExpression.Kind.NOT_MISSING, X)))
                .isEqualTo(SentinelSpans.EXACT_FULL);
            assertThat(sarger().sarg(new IsExpression(IsExpression.Kind.MISSING, X)))
                .isEqualTo(SentinelSpans.WHOLE);
        }

        @Test
        @DisplayName("Predicate equal to the key is an exact self match")
        void testSelfKey() {
            Expression condition = Comparison.gt(Formalizer.key("x"), Literal.of(10));
            KeySarger keySarger = new KeySarger(IndexKey.of(condition).formalize("a"), "a", false, FANOUT);

            assertThat(keySarger.sarg(Comparison.gt(X, Literal.of(10)))).isEqualTo(TermSpans.EXACT_SELF);
        }

        @Test
        @DisplayName("ANY over the indexed array sargs the element key")
        void testArrayKey() {
            IndexKey key = IndexKey.array(new Identifier("v"), "v", Formalizer.key("tags")).formalize("a");
            KeySarger keySarger = new KeySarger(key, "a", false, FANOUT);
            Expression any = Quantified.any("t", Expressions.path("a", "tags"),
                Comparison.eq(new Identifier("t"), Literal.of("red")));

            SargSpans spans = keySarger.sarg(any);

            assertThat(points(spans)).containsExactly(Value.of("red"));
        }

        @Test
        @DisplayName("ANY over a different array is unrelated to the array key")
        void testArrayKeyOtherCollection() {
            IndexKey key = IndexKey.array(new Identifier("v"), "v", Formalizer.key("tags")).formalize("a");
            KeySarger keySarger = new KeySarger(key, "a", false, FANOUT);
            Expression any = Quantified.any("t", Expressions.path("a", "labels"),
                Comparison.eq(new Identifier("t"), Literal.of("red")));

            assertThat(keySarger.sarg(any)).isNull();
        }
    }
}
