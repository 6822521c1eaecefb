package com.sargasso.planner.join;

import com.sargasso.expression.Expression;
import com.sargasso.plan.IndexScan;
import com.sargasso.plan.PlanOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The partially built plan of a FROM clause.
 *
 * <p>Immutable: a join attempt receives the current state and returns a new
 * one, so a rejected attempt leaves nothing behind.
 *
 * @param root the operator producing the rows of the terms planned so far
 * @param coveringScans the covering index scans inside root
 * @param lastOp the operator added by the most recent step
 * @param pendingFilter a condition still to be applied above root, or null
 */
public record BuilderState(PlanOperator root, List<IndexScan> coveringScans,
                           PlanOperator lastOp, Expression pendingFilter) {

    public BuilderState {
        Objects.requireNonNull(root, "root must not be null");
        coveringScans = List.copyOf(coveringScans);
    }

    /**
     * Starts a plan from the scan of the first FROM term.
     *
     * @param scan the scan
     * @return the state
     */
    public static BuilderState start(PlanOperator scan) {
        return new BuilderState(scan, coveringScans(scan), scan, null);
    }

    /**
     * Returns the state after an operator has been placed on top of root.
     *
     * @param op the new root
     * @param added the subtree the operator brought in besides the old root, or null
     * @return the new state
     */
    public BuilderState push(PlanOperator op, PlanOperator added) {
        List<IndexScan> covering = new ArrayList<>(coveringScans);
        if (added != null) {
            covering.addAll(coveringScans(added));
        }
        return new BuilderState(op, covering, op, pendingFilter);
    }

    public BuilderState withPendingFilter(Expression filter) {
        return new BuilderState(root, coveringScans, lastOp, filter);
    }

    /**
     * Collects the covering index scans of a subtree.
     *
     * @param op the subtree
     * @return the scans, in tree order
     */
    public static List<IndexScan> coveringScans(PlanOperator op) {
        List<IndexScan> result = new ArrayList<>();
        collect(op, result);
        return result;
    }

    private static void collect(PlanOperator op, List<IndexScan> result) {
        if (op instanceof IndexScan && ((IndexScan) op).isCovering()) {
            result.add((IndexScan) op);
        }
        for (PlanOperator child : op.children()) {
            collect(child, result);
        }
    }
}
