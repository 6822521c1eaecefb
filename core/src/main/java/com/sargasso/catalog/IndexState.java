package com.sargasso.catalog;

/**
 * Lifecycle state of an index. Only ONLINE indexes are planning candidates.
 */
public enum IndexState {
    ONLINE,
    DEFERRED,
    BUILDING,
    OFFLINE
}
