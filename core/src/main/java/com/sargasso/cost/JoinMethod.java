package com.sargasso.cost;

/**
 * Physical join methods whose cost can be estimated.
 */
public enum JoinMethod {
    NESTED_LOOP,
    HASH,
    LOOKUP
}
