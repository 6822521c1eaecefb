package com.sargasso.planner.sarg;

import java.util.List;

/**
 * Conjunction of spans, realized as an index intersection scan.
 *
 * @param children the intersected spans
 */
public record IntersectSpans(List<SargSpans> children) implements SargSpans {

    public IntersectSpans {
        children = List.copyOf(children);
    }

    @Override
    public int size() {
        int size = 0;
        for (SargSpans child : children) {
            size += child.size();
        }
        return size;
    }

    @Override
    public boolean isExact() {
        for (SargSpans child : children) {
            if (!child.isExact()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean canUseIndexOrder() {
        return false;
    }

    @Override
    public boolean canPushDownOffset() {
        return false;
    }

    @Override
    public boolean canHaveDuplicates() {
        return false;
    }

    @Override
    public String toString() {
        return "Intersect" + children;
    }
}
