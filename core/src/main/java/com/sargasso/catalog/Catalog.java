package com.sargasso.catalog;

import java.util.Optional;

/**
 * Source of keyspace and index metadata.
 *
 * <p>Calls are synchronous. The planner caches what it reads for the duration of
 * one statement and assumes the catalog does not change meanwhile.
 */
public interface Catalog {

    /**
     * Looks up a keyspace by path.
     *
     * @param path the keyspace path
     * @return the keyspace, or empty if it does not exist
     */
    Optional<Keyspace> keyspace(String path);
}
