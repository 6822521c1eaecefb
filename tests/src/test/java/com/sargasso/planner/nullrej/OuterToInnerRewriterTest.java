package com.sargasso.planner.nullrej;

import com.sargasso.algebra.AnsiJoin;
import com.sargasso.algebra.FromTerm;
import com.sargasso.algebra.KeyspaceTerm;
import com.sargasso.algebra.Unnest;
import com.sargasso.catalog.InMemoryCatalog;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.IsExpression;
import com.sargasso.expression.Literal;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.PlannerConfig;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.classify.ExprClassifier;
import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for turning outer joins into inner joins.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("OuterToInnerRewriter Tests")
public class OuterToInnerRewriterTest extends TestBase {

    private FilterRegistry registry;
    private PlanContext context;

    @Override
    protected void doSetUp() {
        registry = new FilterRegistry();
        context = new PlanContext(InMemoryCatalog.builder().build(), null, PlannerConfig.defaults());
    }

    private void register(String alias, int outerLevel) {
        registry.add(new BaseKeyspace(alias, "ks_" + alias, null, outerLevel));
    }

    private void where(Expression expr) {
        new ExprClassifier(registry, context, false).classify(expr);
    }

    private static AnsiJoin leftJoin(FromTerm left, String alias, Expression on) {
        return AnsiJoin.leftJoin(left, KeyspaceTerm.of("ks_" + alias, alias), on);
    }

    @Test
    @DisplayName("WHERE predicate on the outer side converts the join")
    void testWherePredicateConverts() {
        logStep("Given: a LEFT JOIN b ON a.id = b.aid WHERE b.y = 5");
        register("a", 0);
        register("b", 1);
        Expression on = Comparison.eq(Expressions.path("a", "id"), Expressions.path("b", "aid"));
        AnsiJoin join = leftJoin(KeyspaceTerm.of("ks_a", "a"), "b", on);
        where(Comparison.eq(Expressions.path("b", "y"), Literal.of(5)));

        logStep("When: rewriting");
        List<AnsiJoin> converted = new OuterToInnerRewriter(registry, context).rewrite(join);

        logStep("Then: the join is inner and its ON clause is a pushable join filter");
        assertThat(converted).containsExactly(join);
        assertThat(join.isOuter()).isFalse();
        assertThat(registry.get("b").outerLevel()).isZero();
        List<Filter> joinFilters = registry.get("b").joinFilters();
        assertThat(joinFilters).hasSize(1);
        assertThat(joinFilters.get(0).isOnclause()).isFalse();
        assertThat(registry.get("a").joinFilters()).containsExactlyElementsOf(joinFilters);
    }

    @Test
    @DisplayName("IS NULL on the outer side keeps the join outer")
    void testIsNullKeepsOuter() {
        register("a", 0);
        register("b", 1);
        AnsiJoin join = leftJoin(KeyspaceTerm.of("ks_a", "a"), "b",
            Comparison.eq(Expressions.path("a", "id"), Expressions.path("b", "aid")));
        where(new IsExpression(IsExpression.Kind.NULL, Expressions.path("b", "y")));

        List<AnsiJoin> converted = new OuterToInnerRewriter(registry, context).rewrite(join);

        assertThat(converted).isEmpty();
        assertThat(join.isOuter()).isTrue();
        assertThat(registry.get("b").outerLevel()).isEqualTo(1);
    }

    @Test
    @DisplayName("Predicates on the preserved side keep the join outer")
    void testPreservedSidePredicate() {
        register("a", 0);
        register("b", 1);
        AnsiJoin join = leftJoin(KeyspaceTerm.of("ks_a", "a"), "b",
            Comparison.eq(Expressions.path("a", "id"), Expressions.path("b", "aid")));
        where(Comparison.eq(Expressions.path("a", "x"), Literal.of(1)));

        assertThat(new OuterToInnerRewriter(registry, context).rewrite(join)).isEmpty();
    }

    @Test
    @DisplayName("A converted ON clause can convert an earlier outer join")
    void testCascade() {
        logStep("Given: a LEFT JOIN b ON a.id = b.aid LEFT JOIN c ON b.id = c.bid WHERE c.z = 1");
        register("a", 0);
        register("b", 1);
        register("c", 1);
        AnsiJoin first = leftJoin(KeyspaceTerm.of("ks_a", "a"), "b",
            Comparison.eq(Expressions.path("a", "id"), Expressions.path("b", "aid")));
        AnsiJoin second = leftJoin(first, "c",
            Comparison.eq(Expressions.path("b", "id"), Expressions.path("c", "bid")));
        where(Comparison.eq(Expressions.path("c", "z"), Literal.of(1)));

        List<AnsiJoin> converted = new OuterToInnerRewriter(registry, context).rewrite(second);

        logStep("Then: both joins are inner, the later one converted first");
        assertThat(converted).containsExactly(second, first);
        assertThat(registry.get("b").outerLevel()).isZero();
        assertThat(registry.get("c").outerLevel()).isZero();
    }

    @Test
    @DisplayName("Predicate on an unnest of the outer side converts the join")
    void testDependentUnnest() {
        register("a", 0);
        register("b", 1);
        registry.add(new BaseKeyspace("u", null, Expressions.path("b", "items"), 0));
        AnsiJoin join = leftJoin(KeyspaceTerm.of("ks_a", "a"), "b",
            Comparison.eq(Expressions.path("a", "id"), Expressions.path("b", "aid")));
        Unnest unnest = new Unnest(join, Expressions.path("b", "items"), "u", false);
        where(Comparison.eq(Expressions.path("u", "code"), Literal.of("x")));

        List<AnsiJoin> converted = new OuterToInnerRewriter(registry, context).rewrite(unnest);

        assertThat(converted).containsExactly(join);
        assertThat(join.isOuter()).isFalse();
    }
}
