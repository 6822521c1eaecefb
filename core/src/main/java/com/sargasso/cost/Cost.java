package com.sargasso.cost;

/**
 * Opaque cost estimate produced by a {@link CostOracle}.
 *
 * <p>{@link #NOT_AVAILABLE} stands for "no statistics"; any comparison involving
 * it falls back to rule-based decisions.
 *
 * @param cost total cost of producing every row
 * @param cardinality estimated number of rows produced
 * @param firstRowCost cost of producing the first row
 */
public record Cost(double cost, double cardinality, double firstRowCost) {

    /** Selectivity value meaning "not computed". */
    public static final double SELEC_NOT_AVAILABLE = -1.0;

    public static final Cost NOT_AVAILABLE = new Cost(-1.0, -1.0, -1.0);

    public boolean isAvailable() {
        return cost >= 0 && cardinality >= 0;
    }

    /**
     * Returns the cost that matters for a plan.
     *
     * @param firstRow whether only the first rows are needed
     * @return firstRowCost when asked for and available, cost otherwise
     */
    public double effective(boolean firstRow) {
        return firstRow && firstRowCost >= 0 ? firstRowCost : cost;
    }

    @Override
    public String toString() {
        if (!isAvailable()) {
            return "Cost(n/a)";
        }
        return String.format("Cost(cost=%.2f, cardinality=%.2f, firstRow=%.2f)", cost, cardinality, firstRowCost);
    }
}
