package com.sargasso.plan;

import com.sargasso.cost.Cost;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for physical operator candidates produced by the planner.
 *
 * <p>Each node has zero or more children and an optional cost estimate. The
 * planner only builds and compares these trees; executing them is left to the
 * caller.
 */
public abstract class PlanOperator {

    /** Child nodes in the plan tree */
    protected final List<PlanOperator> children;

    private Cost cost = Cost.NOT_AVAILABLE;

    protected PlanOperator() {
        this.children = Collections.emptyList();
    }

    protected PlanOperator(PlanOperator child) {
        this.children = Collections.singletonList(Objects.requireNonNull(child, "child must not be null"));
    }

    protected PlanOperator(List<PlanOperator> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Returns the child nodes of this operator.
     *
     * @return an unmodifiable list of children
     */
    public List<PlanOperator> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the cost estimate of the subtree rooted here.
     *
     * @return the cost, {@link Cost#NOT_AVAILABLE} without a cost oracle
     */
    public Cost cost() {
        return cost;
    }

    public void setCost(Cost cost) {
        this.cost = Objects.requireNonNull(cost, "cost must not be null");
    }

    /**
     * Returns a one-line description of this operator, without its children.
     */
    public abstract String describe();

    /**
     * Renders the subtree as an indented outline.
     *
     * @return the outline
     */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        explain(sb, 0);
        return sb.toString();
    }

    private void explain(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(describe()).append('\n');
        for (PlanOperator child : children) {
            child.explain(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
