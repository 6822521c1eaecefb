package com.sargasso.plan;

import java.util.List;

/**
 * Scans several indexes and returns each document key found by any of them once.
 */
public final class UnionScan extends PlanOperator {

    public UnionScan(List<PlanOperator> scans) {
        super(scans);
        if (scans.size() < 2) {
            throw new IllegalArgumentException("UnionScan requires at least 2 scans");
        }
    }

    public List<PlanOperator> scans() {
        return children();
    }

    @Override
    public String describe() {
        return "UnionScan";
    }
}
