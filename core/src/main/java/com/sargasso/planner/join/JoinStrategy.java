package com.sargasso.planner.join;

/**
 * Physical strategy chosen for one join or nest.
 */
public enum JoinStrategy {
    /** Re-scan the right-hand term for each left row. */
    NESTED_LOOP,
    /** Build a hash table on one side and probe it with the other. */
    HASH,
    /** Fetch right-hand documents directly by key computed from each left row. */
    PRIMARY_LOOKUP
}
