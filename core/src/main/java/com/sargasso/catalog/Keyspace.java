package com.sargasso.catalog;

import java.util.List;
import java.util.OptionalLong;

/**
 * Catalog view of one keyspace (a named document collection).
 */
public interface Keyspace {

    /**
     * Returns the fully qualified path of this keyspace.
     */
    String path();

    /**
     * Returns the estimated number of documents.
     *
     * @return the estimate, or empty if no statistics are available
     */
    OptionalLong documentCount();

    /**
     * Returns all indexes defined on this keyspace, in any state.
     */
    List<Index> indexes();
}
