package com.sargasso.planner.join;

import com.sargasso.cost.Cost;
import com.sargasso.plan.JoinOperator;
import com.sargasso.planner.base.Filter;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;

/**
 * One feasible way to execute a join, with the state it leads to.
 *
 * @param strategy the join strategy
 * @param operator the join operator
 * @param state the builder state with the operator as root
 * @param filterFlags the transient filter flags the attempt set
 */
public record JoinCandidate(JoinStrategy strategy, JoinOperator operator, BuilderState state,
                            Map<Filter, EnumSet<Filter.Flag>> filterFlags) {

    public JoinCandidate {
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(state, "state must not be null");
        filterFlags = Map.copyOf(filterFlags);
    }

    public Cost cost() {
        return operator.cost();
    }

    public boolean isHash() {
        return strategy == JoinStrategy.HASH;
    }
}
