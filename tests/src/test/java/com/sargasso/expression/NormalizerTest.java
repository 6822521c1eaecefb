package com.sargasso.expression;

import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for negation pushdown, DNF expansion and predicate implication.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Normalizer and Implication Tests")
public class NormalizerTest extends TestBase {

    private static final Expression X = Expressions.path("a", "x");
    private static final Expression Y = Expressions.path("a", "y");

    private static Comparison xEq(int v) {
        return Comparison.eq(X, Literal.of(v));
    }

    private static Comparison yEq(int v) {
        return Comparison.eq(Y, Literal.of(v));
    }

    @Nested
    @DisplayName("Negation Normal Form")
    class NegationNormalForm {

        @Test
        @DisplayName("De Morgan pushes NOT through AND")
        void testDeMorgan() {
            Expression nnf = Normalizer.nnf(new Not(new And(xEq(1), Comparison.lt(Y, Literal.of(2)))));

            assertThat(nnf).isEqualTo(new Or(Comparison.ne(X, Literal.of(1)), Comparison.ge(Y, Literal.of(2))));
        }

        @Test
        @DisplayName("Double negation cancels")
        void testDoubleNegation() {
            assertThat(Normalizer.nnf(new Not(new Not(xEq(1))))).isEqualTo(xEq(1));
        }

        @Test
        @DisplayName("NOT IS NULL becomes IS NOT NULL")
        void testNegatedIs() {
            Expression nnf = Normalizer.nnf(new Not(new IsExpression(IsExpression.Kind.NULL, X)));

            assertThat(nnf).isEqualTo(new IsExpression(IsExpression.Kind.NOT_NULL, X));
        }

        @Test
        @DisplayName("NOT IN over an array constructor becomes a conjunction of inequalities")
        void testNegatedIn() {
            Expression nnf = Normalizer.nnf(new Not(new In(X, new ArrayConstruct(Literal.of(1), Literal.of(2)))));

            assertThat(nnf).isEqualTo(new And(Comparison.ne(X, Literal.of(1)), Comparison.ne(X, Literal.of(2))));
        }

        @Test
        @DisplayName("Boolean constants fold")
        void testConstantFolding() {
            assertThat(Normalizer.nnf(new And(xEq(1), Literal.FALSE))).isEqualTo(Literal.FALSE);
            assertThat(Normalizer.nnf(new Or(xEq(1), Literal.TRUE))).isEqualTo(Literal.TRUE);
            assertThat(Normalizer.nnf(new And(xEq(1), Literal.TRUE))).isEqualTo(xEq(1));
        }
    }

    @Nested
    @DisplayName("Disjunctive Normal Form")
    class DisjunctiveNormalForm {

        @Test
        @DisplayName("AND distributes over OR")
        void testDistribution() {
            logStep("Given: (x = 1 OR x = 2) AND y = 3");
            Expression expr = new And(new Or(xEq(1), xEq(2)), yEq(3));

            logStep("When: expanding to DNF");
            Expression dnf = Normalizer.dnf(expr, 16);
            logData("DNF", dnf.toSQL());

            logStep("Then: one disjunct per OR branch");
            assertThat(dnf).isEqualTo(new Or(new And(xEq(1), yEq(3)), new And(xEq(2), yEq(3))));
        }

        @Test
        @DisplayName("Expansion beyond the complexity limit keeps the conjunction")
        void testComplexityLimit() {
            Expression expr = new And(new Or(xEq(1), xEq(2)), new Or(yEq(1), yEq(2)));

            assertThat(Normalizer.dnf(expr, 3)).isEqualTo(expr);
            assertThat(Expressions.flattenOr(Normalizer.dnf(expr, 4))).hasSize(4);
        }
    }

    @Nested
    @DisplayName("Implication")
    class Implications {

        @Test
        @DisplayName("Range predicates imply wider ranges")
        void testRanges() {
            assertThat(Implication.implies(Comparison.gt(X, Literal.of(10)), Comparison.gt(X, Literal.of(5)))).isTrue();
            assertThat(Implication.implies(Comparison.gt(X, Literal.of(5)), Comparison.gt(X, Literal.of(10)))).isFalse();
            assertThat(Implication.implies(xEq(3), Comparison.le(X, Literal.of(3)))).isTrue();
            assertThat(Implication.implies(Comparison.lt(Literal.of(5), X), Comparison.ge(X, Literal.of(5)))).isTrue();
        }

        @Test
        @DisplayName("Compared operands are valued")
        void testValued() {
            IsExpression notNull = new IsExpression(IsExpression.Kind.NOT_NULL, X);

            assertThat(Implication.implies(xEq(1), notNull)).isTrue();
            assertThat(Implication.implies(yEq(1), notNull)).isFalse();
        }

        @Test
        @DisplayName("Conjunctions and disjunctions")
        void testCompound() {
            assertThat(Implication.implies(new And(xEq(1), yEq(2)), yEq(2))).isTrue();
            assertThat(Implication.implies(new Or(xEq(1), xEq(2)), Comparison.lt(X, Literal.of(3)))).isTrue();
            assertThat(Implication.implies(new Or(xEq(1), yEq(2)), xEq(1))).isFalse();
            assertThat(Implication.implies(xEq(1), new Or(yEq(1), xEq(1)))).isTrue();
        }

        @Test
        @DisplayName("Runtime parameters imply nothing beyond equality")
        void testParameters() {
            Comparison param = Comparison.gt(X, new Parameter("p"));

            assertThat(Implication.implies(param, param)).isTrue();
            assertThat(Implication.implies(param, Comparison.gt(X, Literal.of(0)))).isFalse();
        }

        @Test
        @DisplayName("Flattened conjunctions keep operand order")
        void testFlatten() {
            assertThat(Expressions.flattenAnd(new And(xEq(1), new And(yEq(2), xEq(3)))))
                .isEqualTo(List.of(xEq(1), yEq(2), xEq(3)));
        }
    }
}
