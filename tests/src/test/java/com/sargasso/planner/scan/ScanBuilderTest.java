package com.sargasso.planner.scan;

import com.sargasso.algebra.ExpressionTerm;
import com.sargasso.algebra.KeyspaceTerm;
import com.sargasso.algebra.SimpleTerm;
import com.sargasso.catalog.Catalog;
import com.sargasso.catalog.InMemoryCatalog;
import com.sargasso.catalog.Index;
import com.sargasso.catalog.IndexState;
import com.sargasso.cost.Cost;
import com.sargasso.cost.CostOracle;
import com.sargasso.cost.JoinMethod;
import com.sargasso.exception.NoAccessPathException;
import com.sargasso.exception.PlanErrorCode;
import com.sargasso.exception.PlanningException;
import com.sargasso.expression.Comparison;
import com.sargasso.expression.Expression;
import com.sargasso.expression.Expressions;
import com.sargasso.expression.Formalizer;
import com.sargasso.expression.Identifier;
import com.sargasso.expression.Literal;
import com.sargasso.plan.ExpressionScan;
import com.sargasso.plan.Fetch;
import com.sargasso.plan.IndexScan;
import com.sargasso.plan.IntersectScan;
import com.sargasso.plan.KeyScan;
import com.sargasso.plan.PlanOperator;
import com.sargasso.plan.PrimaryScan;
import com.sargasso.plan.UnionScan;
import com.sargasso.planner.PlanContext;
import com.sargasso.planner.PlannerConfig;
import com.sargasso.planner.base.BaseKeyspace;
import com.sargasso.planner.base.Filter;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.classify.ExprClassifier;
import com.sargasso.planner.sarg.KeyRange;
import com.sargasso.planner.sarg.TermSpans;
import com.sargasso.test.TestBase;
import com.sargasso.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for access path selection of single FROM terms.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ScanBuilder Tests")
public class ScanBuilderTest extends TestBase {

    private static final Index PRIMARY = Index.primary("#primary");
    private static final Index IX_X = Index.builder("ix_x").key(Formalizer.key("x")).build();
    private static final Index IX_Y = Index.builder("ix_y").key(Formalizer.key("y")).build();

    private FilterRegistry registry;
    private PlanContext context;

    @Override
    protected void doSetUp() {
        registry = new FilterRegistry();
        registry.add(new BaseKeyspace("a", "ks_a", null, 0));
    }

    private void catalog(Index... indexes) {
        context(InMemoryCatalog.builder().keyspace("ks_a", 1000L, indexes).build(), null);
    }

    private void context(Catalog catalog, CostOracle oracle) {
        context = new PlanContext(catalog, oracle, PlannerConfig.defaults());
    }

    private void where(Expression expr) {
        new ExprClassifier(registry, context, false).classify(expr);
    }

    private PlanOperator build(SimpleTerm term, ScanBuilder.Mode mode, Expression... statementExprs) {
        List<Expression> exprs = new ArrayList<>(List.of(statementExprs));
        if (exprs.isEmpty()) {
            exprs.add(new Identifier(term.alias()));
        }
        ScanBuilder builder = new ScanBuilder(registry, context, exprs);
        return builder.build(registry.get(term.alias()), term, mode);
    }

    private PlanOperator build(Expression... statementExprs) {
        return build(KeyspaceTerm.of("ks_a", "a"), ScanBuilder.Mode.STANDALONE, statementExprs);
    }

    private static Expression eq(String alias, String field, Object value) {
        return Comparison.eq(Expressions.path(alias, field), Literal.of(value));
    }

    private static IndexScan fetchedIndexScan(PlanOperator op) {
        assertThat(op).isInstanceOf(Fetch.class);
        PlanOperator scan = ((Fetch) op).scan();
        assertThat(scan).isInstanceOf(IndexScan.class);
        return (IndexScan) scan;
    }

    // ==================== Index scans ====================

    @Nested
    @DisplayName("Index Scans")
    class IndexScans {

        @Test
        @DisplayName("Secondary index on the filtered key is used")
        void testSecondaryIndex() {
            catalog(PRIMARY, IX_X);
            where(eq("a", "x", 1));

            IndexScan scan = fetchedIndexScan(build());

            assertThat(scan.index()).isEqualTo(IX_X);
            assertThat(scan.spans()).isEqualTo(TermSpans.single(KeyRange.point(Literal.of(1)), true));
            assertThat(registry.get("a").filters().get(0).hasFlag(Filter.Flag.IN_INDEX_SPAN)).isTrue();
        }

        @Test
        @DisplayName("Index holding every referenced field covers the scan")
        void testCovering() {
            catalog(PRIMARY, IX_X);
            where(eq("a", "x", 1));

            PlanOperator op = build(eq("a", "x", 1), Expressions.path("a", "x"), Expressions.documentKey("a"));

            assertThat(op).isInstanceOf(IndexScan.class);
            assertThat(((IndexScan) op).isCovering()).isTrue();
        }

        @Test
        @DisplayName("Index missing a projected field does not cover")
        void testNotCovering() {
            catalog(PRIMARY, IX_X);
            where(eq("a", "x", 1));

            IndexScan scan = fetchedIndexScan(build(eq("a", "x", 1), Expressions.path("a", "name")));

            assertThat(scan.isCovering()).isFalse();
        }

        @Test
        @DisplayName("Rule mode intersects all minimal candidates")
        void testIntersect() {
            catalog(PRIMARY, IX_Y, IX_X);
            where(Expressions.and(eq("a", "x", 1), eq("a", "y", 2)));

            PlanOperator op = build();

            assertThat(op).isInstanceOf(Fetch.class);
            PlanOperator scan = ((Fetch) op).scan();
            assertThat(scan).isInstanceOf(IntersectScan.class);
            assertThat(((IntersectScan) scan).scans())
                .extracting(s -> ((IndexScan) s).index().name())
                .containsExactly("ix_x", "ix_y");
        }

        @Test
        @DisplayName("Cost mode picks the cheapest candidate")
        void testCheapest() {
            Map<String, Double> costs = Map.of("ix_x", 50.0, "ix_y", 5.0);
            context(InMemoryCatalog.builder().keyspace("ks_a", 1000L, PRIMARY, IX_X, IX_Y).build(),
                new StubOracle(costs));
            where(Expressions.and(eq("a", "x", 1), eq("a", "y", 2)));

            IndexScan scan = fetchedIndexScan(build());

            assertThat(scan.index()).isEqualTo(IX_Y);
            assertThat(scan.cost().cost()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("OR over different keys becomes a union scan")
        void testUnionScan() {
            catalog(PRIMARY, IX_X, IX_Y);
            where(Expressions.or(eq("a", "x", 1), eq("a", "y", 2)));

            PlanOperator op = build();

            PlanOperator scan = ((Fetch) op).scan();
            assertThat(scan).isInstanceOf(UnionScan.class);
            assertThat(((UnionScan) scan).scans()).hasSize(2);
            assertThat(registry.get("a").filters()).allMatch(f -> f.hasFlag(Filter.Flag.IN_INDEX_SPAN));
        }

        @Test
        @DisplayName("Partial index is used only when the predicate implies its condition")
        void testPartialIndex() {
            Index partial = Index.builder("ix_x_big")
                .key(Formalizer.key("x"))
                .condition(Comparison.gt(Formalizer.key("x"), Literal.of(10)))
                .build();
            catalog(PRIMARY, partial);
            where(Comparison.gt(Expressions.path("a", "x"), Literal.of(20)));

            assertThat(fetchedIndexScan(build()).index()).isEqualTo(partial);

            doSetUp();
            catalog(PRIMARY, partial);
            where(Comparison.gt(Expressions.path("a", "x"), Literal.of(5)));

            assertThat(((Fetch) build()).scan()).isInstanceOf(PrimaryScan.class);
        }

        @Test
        @DisplayName("Offline indexes are ignored")
        void testOfflineIndex() {
            Index offline = Index.builder("ix_x").key(Formalizer.key("x")).state(IndexState.BUILDING).build();
            catalog(PRIMARY, offline);
            where(eq("a", "x", 1));

            assertThat(((Fetch) build()).scan()).isInstanceOf(PrimaryScan.class);
        }
    }

    // ==================== Index hints ====================

    @Nested
    @DisplayName("Index Hints")
    class IndexHints {

        @Test
        @DisplayName("USE INDEX restricts the candidates")
        void testUseIndex() {
            catalog(PRIMARY, IX_X, IX_Y);
            where(Expressions.and(eq("a", "x", 1), eq("a", "y", 2)));
            KeyspaceTerm term = KeyspaceTerm.builder("ks_a").alias("a").useIndex("ix_y").build();

            IndexScan scan = fetchedIndexScan(build(term, ScanBuilder.Mode.STANDALONE));

            assertThat(scan.index()).isEqualTo(IX_Y);
            assertThat(context.hints().warnings()).isEmpty();
        }

        @Test
        @DisplayName("Unknown hinted index is reported and ignored")
        void testUnknownHint() {
            catalog(PRIMARY, IX_X);
            where(eq("a", "x", 1));
            KeyspaceTerm term = KeyspaceTerm.builder("ks_a").alias("a").useIndex("ix_nope").build();

            IndexScan scan = fetchedIndexScan(build(term, ScanBuilder.Mode.STANDALONE));

            assertThat(scan.index()).isEqualTo(IX_X);
            assertThat(context.hints().warnings()).hasSize(1);
            assertThat(context.hints().warnings().get(0).alias()).isEqualTo("a");
            assertThat(context.hints().warnings().get(0).reason()).contains("not found");
        }
    }

    // ==================== Key and fallback scans ====================

    @Nested
    @DisplayName("Key and Fallback Scans")
    class Fallbacks {

        @Test
        @DisplayName("Equality on the document key is a key scan")
        void testDocumentKey() {
            catalog(PRIMARY, IX_X);
            where(Expressions.and(Comparison.eq(Expressions.documentKey("a"), Literal.of("k1")), eq("a", "x", 1)));

            PlanOperator op = build();

            PlanOperator scan = ((Fetch) op).scan();
            assertThat(scan).isInstanceOf(KeyScan.class);
            assertThat(((KeyScan) scan).keys()).isEqualTo(Literal.of("k1"));
        }

        @Test
        @DisplayName("USE KEYS is a key scan")
        void testUseKeys() {
            catalog(PRIMARY);
            KeyspaceTerm term = KeyspaceTerm.builder("ks_a").alias("a").useKeys(Literal.of(List.of("k1", "k2"))).build();

            PlanOperator op = build(term, ScanBuilder.Mode.STANDALONE);

            assertThat(((Fetch) op).scan()).isInstanceOf(KeyScan.class);
        }

        @Test
        @DisplayName("Unindexed predicate falls back to the primary index")
        void testPrimaryFallback() {
            catalog(PRIMARY, IX_X);
            where(eq("a", "z", 1));

            PlanOperator scan = ((Fetch) build()).scan();

            assertThat(scan).isInstanceOf(PrimaryScan.class);
        }

        @Test
        @DisplayName("No usable index and no primary index fails")
        void testNoAccessPath() {
            catalog(IX_X);
            where(eq("a", "z", 1));

            assertThatThrownBy(() -> build())
                .isInstanceOf(NoAccessPathException.class)
                .satisfies(e -> assertThat(((PlanningException) e).getErrorCode()).isEqualTo(PlanErrorCode.NO_ACCESS_PATH));
        }

        @Test
        @DisplayName("Missing keyspace is reported")
        void testUnknownKeyspace() {
            context(InMemoryCatalog.builder().build(), null);

            assertThatThrownBy(() -> build())
                .isInstanceOf(PlanningException.class)
                .satisfies(e -> assertThat(((PlanningException) e).getErrorCode()).isEqualTo(PlanErrorCode.UNKNOWN_KEYSPACE));
        }

        @Test
        @DisplayName("Expression terms are scanned directly")
        void testExpressionTerm() {
            catalog(PRIMARY);
            registry.add(new BaseKeyspace("e", null, null, 0));
            registry.get("a").setFlag(BaseKeyspace.Flag.PLAN_DONE);
            ExpressionTerm term = new ExpressionTerm(Expressions.path("a", "items"), "e");

            PlanOperator op = build(term, ScanBuilder.Mode.NESTED_LOOP);

            assertThat(op).isInstanceOf(ExpressionScan.class);
            assertThat(((ExpressionScan) op).isCorrelated()).isTrue();
        }
    }

    // ==================== Join modes ====================

    @Nested
    @DisplayName("Join Modes")
    class JoinModes {

        private KeyspaceTerm joinSetUp(Index... bIndexes) {
            context(InMemoryCatalog.builder()
                .keyspace("ks_a", 1000L, PRIMARY)
                .keyspace("ks_b", 1000L, bIndexes)
                .build(), null);
            registry.add(new BaseKeyspace("b", "ks_b", null, 0));
            registry.get("a").setFlag(BaseKeyspace.Flag.PLAN_DONE);
            new ExprClassifier(registry, context, true)
                .classify(Comparison.eq(Expressions.path("a", "k"), Expressions.path("b", "k")));
            return KeyspaceTerm.of("ks_b", "b");
        }

        @Test
        @DisplayName("Nested-loop inner scan uses the join key")
        void testNestedLoopIndex() {
            Index ixK = Index.builder("ix_k").key(Formalizer.key("k")).build();
            KeyspaceTerm term = joinSetUp(Index.primary("#primary"), ixK);

            IndexScan scan = fetchedIndexScan(build(term, ScanBuilder.Mode.NESTED_LOOP));

            assertThat(scan.index()).isEqualTo(ixK);
            assertThat(scan.spans()).isEqualTo(TermSpans.single(KeyRange.point(Expressions.path("a", "k")), true));
        }

        @Test
        @DisplayName("Nested-loop inner scan never falls back to the primary index")
        void testNestedLoopNoPrimary() {
            KeyspaceTerm term = joinSetUp(Index.primary("#primary"));

            assertThatThrownBy(() -> build(term, ScanBuilder.Mode.NESTED_LOOP))
                .isInstanceOf(NoAccessPathException.class);
        }

        @Test
        @DisplayName("Hash side ignores join predicates")
        void testHashSide() {
            Index ixK = Index.builder("ix_k").key(Formalizer.key("k")).build();
            KeyspaceTerm term = joinSetUp(Index.primary("#primary"), ixK);

            PlanOperator op = build(term, ScanBuilder.Mode.HASH);

            assertThat(((Fetch) op).scan()).isInstanceOf(PrimaryScan.class);
        }
    }

    /**
     * Oracle pricing index scans from a table.
     */
    static final class StubOracle implements CostOracle {
        private final Map<String, Double> indexCosts;

        StubOracle(Map<String, Double> indexCosts) {
            this.indexCosts = indexCosts;
        }

        @Override
        public double selectivity(Expression filter, String alias, long documentCount) {
            return Cost.SELEC_NOT_AVAILABLE;
        }

        @Override
        public Cost indexScanCost(Index index, String alias, double selectivity, long documentCount) {
            Double cost = indexCosts.get(index.name());
            return cost == null ? Cost.NOT_AVAILABLE : new Cost(cost, 10.0, 1.0);
        }

        @Override
        public Cost keyScanCost(String alias, double keys) {
            return new Cost(keys, keys, 1.0);
        }

        @Override
        public Cost joinCost(JoinMethod method, Cost left, Cost right, boolean buildRight) {
            return Cost.NOT_AVAILABLE;
        }
    }
}
