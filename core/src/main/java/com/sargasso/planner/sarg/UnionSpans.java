package com.sargasso.planner.sarg;

import java.util.List;

/**
 * Disjunction of spans, realized as an index union scan.
 *
 * @param children the united spans
 */
public record UnionSpans(List<SargSpans> children) implements SargSpans {

    public UnionSpans {
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
        return true;
    }

    @Override
    public String toString() {
        return "Union" + children;
    }
}
