package com.sargasso.exception;

/**
 * Violation of a planner invariant, such as an alias missing from the filter
 * registry where it must be present. Never retried.
 */
public class PlanInternalException extends PlanningException {

    public PlanInternalException(String message) {
        super(PlanErrorCode.INTERNAL, message, null);
    }

    public PlanInternalException(String message, String alias) {
        super(PlanErrorCode.INTERNAL, message, alias);
    }
}
