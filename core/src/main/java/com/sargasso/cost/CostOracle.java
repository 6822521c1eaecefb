package com.sargasso.cost;

import com.sargasso.catalog.Index;
import com.sargasso.expression.Expression;

/**
 * External cost model.
 *
 * <p>When a planner has a cost oracle it runs in cost-based mode: it estimates
 * selectivities, compares alternative scans and join strategies by cost, and
 * considers hash joins without a hint. Without one, every decision uses a
 * deterministic rule. Implementations return {@link Cost#NOT_AVAILABLE} or
 * {@link Cost#SELEC_NOT_AVAILABLE} when they lack statistics.
 */
public interface CostOracle {

    /**
     * Estimates the fraction of documents of a keyspace that satisfy a filter.
     *
     * @param filter the single-keyspace filter
     * @param alias the alias of the keyspace
     * @param documentCount the keyspace's document count
     * @return a value in [0, 1], or {@link Cost#SELEC_NOT_AVAILABLE}
     */
    double selectivity(Expression filter, String alias, long documentCount);

    /**
     * Estimates the cost of scanning an index.
     *
     * @param index the index (primary or secondary)
     * @param alias the alias of the scanned keyspace
     * @param selectivity the fraction of index entries the spans select
     * @param documentCount the keyspace's document count, or -1 if unknown
     * @return the cost
     */
    Cost indexScanCost(Index index, String alias, double selectivity, long documentCount);

    /**
     * Estimates the cost of fetching documents by key.
     *
     * @param alias the alias of the fetched keyspace
     * @param keys the estimated number of keys
     * @return the cost
     */
    Cost keyScanCost(String alias, double keys);

    /**
     * Estimates the cost of a join.
     *
     * @param method the join method
     * @param left the cost of the left (outer) input
     * @param right the cost of the right input, per left row for nested-loop joins
     * @param buildRight for hash joins, whether the right input is the build side
     * @return the cost of the joined result
     */
    Cost joinCost(JoinMethod method, Cost left, Cost right, boolean buildRight);
}
