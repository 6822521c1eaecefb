package com.sargasso.algebra;

/**
 * Join method hint on the right-hand term of a join.
 *
 * <p>{@code USE HASH(BUILD)} asks for a hash join building on this term,
 * {@code USE HASH(PROBE)} for a hash join probing with it, and {@code USE NL}
 * for a nested-loop join.
 */
public enum JoinHint {
    NONE,
    USE_HASH_BUILD,
    USE_HASH_PROBE,
    USE_NL;

    public boolean isHash() {
        return this == USE_HASH_BUILD || this == USE_HASH_PROBE;
    }
}
