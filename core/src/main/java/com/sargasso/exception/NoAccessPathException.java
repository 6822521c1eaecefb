package com.sargasso.exception;

/**
 * No feasible way to scan a keyspace or to join a term.
 *
 * <p>Thrown with {@link PlanErrorCode#NO_ACCESS_PATH} when no index and no
 * primary scan can serve a keyspace, and with {@link PlanErrorCode#NO_JOIN_PATH}
 * when a nested-loop join finds neither a usable index nor a key lookup for its
 * right-hand term. The join strategy selector absorbs it when another strategy
 * is still feasible.
 */
public class NoAccessPathException extends PlanningException {

    public NoAccessPathException(PlanErrorCode errorCode, String message, String alias) {
        super(errorCode, message, alias);
    }

    public NoAccessPathException(PlanErrorCode errorCode, String message, String alias, Throwable cause) {
        super(errorCode, message, alias, cause);
    }
}
