package com.sargasso.planner;

import com.sargasso.catalog.Catalog;
import com.sargasso.cost.CostOracle;
import java.util.Objects;
import java.util.Optional;

/**
 * Collaborators and settings shared by every step of planning one statement.
 */
public final class PlanContext {

    private final Catalog catalog;
    private final CostOracle costOracle;
    private final PlannerConfig config;
    private final HintReport hints;

    /**
     * Creates a context.
     *
     * @param catalog the catalog
     * @param costOracle the cost oracle, or null for rule-based planning
     * @param config the settings
     */
    public PlanContext(Catalog catalog, CostOracle costOracle, PlannerConfig config) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.costOracle = costOracle;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.hints = new HintReport();
    }

    public Catalog catalog() {
        return catalog;
    }

    public Optional<CostOracle> costOracle() {
        return Optional.ofNullable(costOracle);
    }

    /**
     * Returns whether decisions compare costs rather than follow rules.
     */
    public boolean isCostBased() {
        return costOracle != null;
    }

    public PlannerConfig config() {
        return config;
    }

    public HintReport hints() {
        return hints;
    }
}
