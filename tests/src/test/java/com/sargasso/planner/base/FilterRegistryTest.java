package com.sargasso.planner.base;

import com.sargasso.exception.PlanErrorCode;
import com.sargasso.exception.PlanInternalException;
import com.sargasso.expression.Arithmetic;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Literal;
import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the per-statement filter registry.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FilterRegistry Tests")
public class FilterRegistryTest extends TestBase {

    private FilterRegistry registry;

    @Override
    protected void doSetUp() {
        registry = new FilterRegistry();
        registry.add(new BaseKeyspace("a", "ks_a", null, 0));
        registry.add(new BaseKeyspace("b", "ks_b", null, 0));
        registry.add(new BaseKeyspace("c", "ks_c", null, 0));
    }

    private static Filter filter(Expression expr, boolean onclause, String... aliases) {
        Set<String> keyspaces = new LinkedHashSet<>(List.of(aliases));
        return new Filter(expr, expr, keyspaces, onclause, aliases.length > 1);
    }

    private static Expression eq(String alias, String field, Object value) {
        return Comparison.eq(Expressions.path(alias, field), Literal.of(value));
    }

    // ==================== Registration ====================

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Aliases keep FROM-clause order")
        void testOrder() {
            assertThat(registry.aliases()).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Duplicate alias is an internal error")
        void testDuplicateAlias() {
            assertThatThrownBy(() -> registry.add(new BaseKeyspace("a", "other", null, 0)))
                .isInstanceOf(PlanInternalException.class)
                .satisfies(e -> {
                    PlanInternalException ex = (PlanInternalException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(PlanErrorCode.INTERNAL);
                    assertThat(ex.getAlias()).isEqualTo("a");
                });
        }

        @Test
        @DisplayName("Unknown alias is an internal error")
        void testUnknownAlias() {
            assertThatThrownBy(() -> registry.get("z"))
                .isInstanceOf(PlanInternalException.class)
                .hasMessageContaining("filter registry");
            assertThat(registry.find("z")).isEmpty();
        }

        @Test
        @DisplayName("Planned aliases follow the PLAN_DONE flag")
        void testPlannedAliases() {
            registry.get("b").setFlag(BaseKeyspace.Flag.PLAN_DONE);

            assertThat(registry.plannedAliases()).containsExactly("b");
        }
    }

    // ==================== Filters ====================

    @Nested
    @DisplayName("Filters")
    class Filters {

        @Test
        @DisplayName("Attach places single and multi-keyspace filters")
        void testAttach() {
            Filter single = filter(eq("a", "x", 1), false, "a");
            Filter join = filter(Comparison.eq(Expressions.path("a", "k"), Expressions.path("b", "k")), false, "a", "b");

            registry.attach(single);
            registry.attach(join);

            assertThat(registry.get("a").filters()).containsExactly(single);
            assertThat(registry.get("a").joinFilters()).containsExactly(join);
            assertThat(registry.get("b").joinFilters()).containsExactly(join);
        }

        @Test
        @DisplayName("Planning one side moves a two-way join filter to the other side")
        void testMoveJoinFilters() {
            Filter join = filter(Comparison.eq(Expressions.path("a", "k"), Expressions.path("b", "k")), false, "a", "b");
            registry.attach(join);

            registry.moveJoinFilters("a");

            assertThat(registry.get("a").joinFilters()).isEmpty();
            assertThat(registry.get("b").joinFilters()).isEmpty();
            assertThat(registry.get("b").filters()).containsExactly(join);
            assertThat(join.keyspaces()).containsExactly("b");
            assertThat(join.origKeyspaces()).containsExactly("a", "b");
            assertThat(join.isJoin()).isTrue();
        }

        @Test
        @DisplayName("Three-way join filter stays a join filter until two sides are planned")
        void testMoveThreeWay() {
            Expression expr = Comparison.eq(
                Expressions.path("a", "k"),
                new Arithmetic(Arithmetic.Operator.ADD,
                    Expressions.path("b", "k"), Expressions.path("c", "k")));
            Filter join = filter(expr, false, "a", "b", "c");
            registry.attach(join);

            registry.moveJoinFilters("a");

            assertThat(registry.get("b").joinFilters()).containsExactly(join);
            assertThat(registry.get("c").joinFilters()).containsExactly(join);

            registry.moveJoinFilters("b");

            assertThat(registry.get("c").joinFilters()).isEmpty();
            assertThat(registry.get("c").filters()).containsExactly(join);
        }

        @Test
        @DisplayName("Transient flags are cleared everywhere")
        void testClearTransientFlags() {
            Filter single = filter(eq("a", "x", 1), false, "a");
            single.setFlag(Filter.Flag.IN_INDEX_SPAN);
            single.setFlag(Filter.Flag.DERIVED);
            registry.attach(single);

            registry.clearTransientFlags();

            assertThat(single.hasFlag(Filter.Flag.IN_INDEX_SPAN)).isFalse();
            assertThat(single.isDerived()).isTrue();
        }
    }

    // ==================== Combined predicates ====================

    @Nested
    @DisplayName("Combined Predicates")
    class Combine {

        @Test
        @DisplayName("Combines every filter of an inner keyspace")
        void testInnerKeyspace() {
            registry.attach(filter(eq("b", "x", 1), false, "b"));
            registry.attach(filter(eq("b", "y", 2), true, "b"));

            BaseKeyspace b = registry.get("b");
            registry.combineFilters(b, false, 1024);

            assertThat(b.dnfPred()).isEqualTo(Expressions.and(eq("b", "x", 1), eq("b", "y", 2)));
            assertThat(b.origPred()).isEqualTo(b.dnfPred());
            assertThat(b.onclause()).isEqualTo(eq("b", "y", 2));
            assertThat(b.hasFlag(BaseKeyspace.Flag.ONCLAUSE_ONLY)).isFalse();
        }

        @Test
        @DisplayName("Outer keyspace only uses ON clause filters")
        void testOuterKeyspace() {
            registry.add(new BaseKeyspace("d", "ks_d", null, 1));
            registry.attach(filter(eq("d", "x", 1), false, "d"));
            registry.attach(filter(eq("d", "y", 2), true, "d"));

            BaseKeyspace d = registry.get("d");
            registry.combineFilters(d, false, 1024);

            assertThat(d.dnfPred()).isEqualTo(eq("d", "y", 2));
            assertThat(d.hasFlag(BaseKeyspace.Flag.ONCLAUSE_ONLY)).isTrue();
        }

        @Test
        @DisplayName("Join filters can be left out")
        void testExcludeJoinFilters() {
            Filter join = filter(Comparison.eq(Expressions.path("a", "k"), Expressions.path("b", "k")), true, "a", "b");
            registry.attach(join);
            registry.get("a").setFlag(BaseKeyspace.Flag.PLAN_DONE);
            registry.moveJoinFilters("a");
            registry.attach(filter(eq("b", "x", 1), false, "b"));

            BaseKeyspace b = registry.get("b");
            registry.combineFilters(b, true, 1024);
            assertThat(b.dnfPred()).isEqualTo(eq("b", "x", 1));

            registry.combineFilters(b, false, 1024);
            assertThat(b.dnfPred()).isEqualTo(Expressions.and(join.fltrExpr(), eq("b", "x", 1)));
        }

        @Test
        @DisplayName("Derived filters are left out of the original predicate")
        void testDerivedExcludedFromOrig() {
            Filter derived = filter(eq("a", "x", 1), false, "a");
            derived.setFlag(Filter.Flag.DERIVED);
            registry.attach(derived);

            BaseKeyspace a = registry.get("a");
            registry.combineFilters(a, false, 1024);

            assertThat(a.dnfPred()).isEqualTo(eq("a", "x", 1));
            assertThat(a.origPred()).isNull();
        }

        @Test
        @DisplayName("No filters means no predicates")
        void testEmpty() {
            BaseKeyspace c = registry.get("c");
            registry.combineFilters(c, false, 1024);

            assertThat(c.dnfPred()).isNull();
            assertThat(c.origPred()).isNull();
        }
    }

    // ==================== Copies and unnests ====================

    @Test
    @DisplayName("Copies share one copy of a shared join filter")
    void testCopy() {
        Filter join = filter(Comparison.eq(Expressions.path("a", "k"), Expressions.path("b", "k")), false, "a", "b");
        registry.attach(join);

        FilterRegistry copy = registry.copy(true);
        Filter copied = copy.get("a").joinFilters().get(0);
        copied.setFlag(Filter.Flag.IN_HASH_JOIN);

        assertThat(copied).isNotSameAs(join);
        assertThat(copy.get("b").joinFilters().get(0)).isSameAs(copied);
        assertThat(join.hasFlag(Filter.Flag.IN_HASH_JOIN)).isFalse();
        assertThat(registry.copy(false).get("a").joinFilters()).isEmpty();
    }

    @Test
    @DisplayName("Dependent unnests are found through chains")
    void testDependentUnnests() {
        registry.add(new BaseKeyspace("u", null, Expressions.path("b", "items"), 0));
        registry.add(new BaseKeyspace("v", null, Expressions.path("u", "parts"), 0));
        registry.add(new BaseKeyspace("w", null, Expressions.path("a", "tags"), 0));

        assertThat(registry.dependentUnnests("b")).containsExactly("u", "v");
        assertThat(registry.dependentUnnests("c")).isEmpty();
    }
}
