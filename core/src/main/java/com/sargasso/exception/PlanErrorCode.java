package com.sargasso.exception;

/**
 * Error codes for planning failures.
 */
public enum PlanErrorCode {
    INTERNAL(4000, "Internal planner error"),
    NO_ACCESS_PATH(4010, "No index available for keyspace"),
    NO_JOIN_PATH(4020, "No index available for join term"),
    UNKNOWN_KEYSPACE(4030, "Keyspace not found");

    private final int code;
    private final String description;

    PlanErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
