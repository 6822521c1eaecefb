package com.sargasso.catalog;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Immutable catalog held in memory, for embedding and tests.
 *
 * <pre>
 *   Catalog catalog = InMemoryCatalog.builder()
 *       .keyspace("orders", 10_000, Index.primary("#primary"))
 *       .build();
 * </pre>
 */
public final class InMemoryCatalog implements Catalog {

    private final Map<String, Keyspace> keyspaces;

    private InMemoryCatalog(Map<String, Keyspace> keyspaces) {
        this.keyspaces = Collections.unmodifiableMap(new LinkedHashMap<>(keyspaces));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Keyspace> keyspace(String path) {
        return Optional.ofNullable(keyspaces.get(path));
    }

    private static final class InMemoryKeyspace implements Keyspace {
        private final String path;
        private final OptionalLong documentCount;
        private final List<Index> indexes;

        private InMemoryKeyspace(String path, OptionalLong documentCount, List<Index> indexes) {
            this.path = path;
            this.documentCount = documentCount;
            this.indexes = List.copyOf(indexes);
        }

        @Override
        public String path() {
            return path;
        }

        @Override
        public OptionalLong documentCount() {
            return documentCount;
        }

        @Override
        public List<Index> indexes() {
            return indexes;
        }

        @Override
        public String toString() {
            return "Keyspace(" + path + ", indexes=" + indexes.size() + ")";
        }
    }

    /**
     * Builder for in-memory catalogs.
     */
    public static final class Builder {
        private final Map<String, Keyspace> keyspaces = new LinkedHashMap<>();

        /**
         * Adds a keyspace with a known document count.
         */
        public Builder keyspace(String path, long documentCount, Index... indexes) {
            return add(path, OptionalLong.of(documentCount), indexes);
        }

        /**
         * Adds a keyspace without statistics.
         */
        public Builder keyspace(String path, Index... indexes) {
            return add(path, OptionalLong.empty(), indexes);
        }

        private Builder add(String path, OptionalLong documentCount, Index... indexes) {
            Objects.requireNonNull(path, "path must not be null");
            keyspaces.put(path, new InMemoryKeyspace(path, documentCount, Arrays.asList(indexes)));
            return this;
        }

        public InMemoryCatalog build() {
            return new InMemoryCatalog(keyspaces);
        }
    }
}
