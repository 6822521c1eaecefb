package com.sargasso.plan;

import java.util.List;

/**
 * Scans several indexes and keeps the document keys returned by all of them.
 */
public final class IntersectScan extends PlanOperator {

    public IntersectScan(List<PlanOperator> scans) {
        super(scans);
        if (scans.size() < 2) {
            throw new IllegalArgumentException("IntersectScan requires at least 2 scans");
        }
    }

    public List<PlanOperator> scans() {
        return children();
    }

    @Override
    public String describe() {
        return "IntersectScan";
    }
}
