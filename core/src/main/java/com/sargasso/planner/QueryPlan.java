package com.sargasso.planner;

import com.sargasso.plan.PlanOperator;
import com.sargasso.planner.base.FilterRegistry;
import com.sargasso.planner.join.JoinStrategy;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of planning one statement.
 */
public final class QueryPlan {

    private final PlanOperator root;
    private final FilterRegistry registry;
    private final List<HintWarning> warnings;
    private final Map<String, JoinStrategy> joinStrategies;

    /**
     * Creates a plan.
     *
     * @param root the root operator
     * @param registry the filter registry as planning left it
     * @param warnings hints that were not followed
     * @param joinStrategies the strategy of each join, by right-hand alias
     */
    public QueryPlan(PlanOperator root, FilterRegistry registry, List<HintWarning> warnings,
                     Map<String, JoinStrategy> joinStrategies) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.warnings = List.copyOf(warnings);
        this.joinStrategies = Collections.unmodifiableMap(new LinkedHashMap<>(joinStrategies));
    }

    public PlanOperator root() {
        return root;
    }

    /**
     * Returns the filter registry, for collaborators that inspect the classified predicates.
     */
    public FilterRegistry registry() {
        return registry;
    }

    public List<HintWarning> warnings() {
        return warnings;
    }

    public Map<String, JoinStrategy> joinStrategies() {
        return joinStrategies;
    }

    /**
     * Returns the strategy chosen for the join introducing an alias.
     *
     * @param alias the right-hand alias of a join or nest
     * @return the strategy, or null if the alias is not joined
     */
    public JoinStrategy joinStrategy(String alias) {
        return joinStrategies.get(alias);
    }

    public String explain() {
        return root.explain();
    }

    @Override
    public String toString() {
        return "QueryPlan{joins=" + joinStrategies + ", warnings=" + warnings.size() + "}\n" + explain();
    }
}
