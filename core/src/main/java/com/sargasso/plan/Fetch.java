package com.sargasso.plan;

import java.util.Objects;

/**
 * Fetches the documents whose keys the child produces.
 */
public final class Fetch extends PlanOperator {

    private final String alias;

    public Fetch(String alias, PlanOperator scan) {
        super(scan);
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public String alias() {
        return alias;
    }

    public PlanOperator scan() {
        return children.get(0);
    }

    @Override
    public String describe() {
        return "Fetch(" + alias + ")";
    }
}
