package com.sargasso.plan;

/**
 * Produces no rows. Planned when the WHERE clause is constant FALSE.
 */
public final class EmptyResult extends PlanOperator {

    @Override
    public String describe() {
        return "EmptyResult";
    }
}
