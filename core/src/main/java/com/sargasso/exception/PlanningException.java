package com.sargasso.exception;

import java.util.Objects;

/**
 * Base class for errors that abort planning of a statement.
 *
 * <p>Every planning error carries an error code and, where one applies, the alias
 * of the FROM term being planned. The planner never returns a partial plan:
 * an exception that escapes a join or scan aborts the whole statement.
 */
public class PlanningException extends RuntimeException {

    private final PlanErrorCode errorCode;
    private final String alias;

    /**
     * Creates a planning exception.
     *
     * @param errorCode the error code
     * @param message the error message
     * @param alias the alias of the term being planned (may be null)
     */
    public PlanningException(PlanErrorCode errorCode, String message, String alias) {
        super(format(errorCode, message, alias));
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.alias = alias;
    }

    /**
     * Creates a planning exception with a cause.
     *
     * @param errorCode the error code
     * @param message the error message
     * @param alias the alias of the term being planned (may be null)
     * @param cause the underlying cause
     */
    public PlanningException(PlanErrorCode errorCode, String message, String alias, Throwable cause) {
        super(format(errorCode, message, alias), cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.alias = alias;
    }

    public PlanErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the alias of the term being planned when the error occurred.
     *
     * @return the alias, or null if not available
     */
    public String getAlias() {
        return alias;
    }

    private static String format(PlanErrorCode errorCode, String message, String alias) {
        String text = "[" + errorCode.code() + "] " + message;
        return alias != null ? text + " (alias: " + alias + ")" : text;
    }
}
