package com.demo.groupchat.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Describes one logical collection: its document type, how to derive the primary key,
 * and the secondary indexes the backend must maintain.
 *
 * @param <T> document type
 */
public final class DocumentCollection<T> {

    private static final String KEY_SEPARATOR = "#";

    private final String name;
    private final Class<T> type;
    private final Function<T, String> keyExtractor;
    private final Map<String, Index<T>> indexes;

    private DocumentCollection(Builder<T> builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.keyExtractor = builder.keyExtractor;
        this.indexes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.indexes));
    }

    public static <T> Builder<T> builder(String name, Class<T> type, Function<T, String> keyExtractor) {
        return new Builder<>(name, type, keyExtractor);
    }

    /**
     * Compose a primary key from its parts, e.g. {@code key(conversationId, timestamp)}.
     */
    public static String key(String... parts) {
        return String.join(KEY_SEPARATOR, parts);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public String keyOf(T document) {
        String key = keyExtractor.apply(document);
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Document in " + name + " has no primary key");
        }
        return key;
    }

    public Index<T> index(String indexName) {
        Index<T> index = indexes.get(indexName);
        if (index == null) {
            throw new IllegalArgumentException("Unknown index " + indexName + " on " + name);
        }
        return index;
    }

    public Collection<Index<T>> indexes() {
        return indexes.values();
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Secondary index over one attribute. Documents whose attribute is null are not indexed.
     */
    public static final class Index<T> {
        private final String name;
        private final Function<T, String> valueExtractor;
        private final Function<T, String> sortKeyExtractor;
        private final boolean unique;

        private Index(String name, Function<T, String> valueExtractor,
                      Function<T, String> sortKeyExtractor, boolean unique) {
            this.name = name;
            this.valueExtractor = valueExtractor;
            this.sortKeyExtractor = sortKeyExtractor;
            this.unique = unique;
        }

        public String name() {
            return name;
        }

        public boolean isUnique() {
            return unique;
        }

        public String valueOf(T document) {
            return valueExtractor.apply(document);
        }

        /**
         * Sort key within one index value; empty when the index is unordered.
         */
        public String sortKeyOf(T document) {
            if (sortKeyExtractor == null) {
                return "";
            }
            return Objects.requireNonNullElse(sortKeyExtractor.apply(document), "");
        }
    }

    public static final class Builder<T> {
        private final String name;
        private final Class<T> type;
        private final Function<T, String> keyExtractor;
        private final Map<String, Index<T>> indexes = new LinkedHashMap<>();

        private Builder(String name, Class<T> type, Function<T, String> keyExtractor) {
            this.name = name;
            this.type = type;
            this.keyExtractor = keyExtractor;
        }

        public Builder<T> index(String indexName, Function<T, String> value) {
            return index(indexName, value, null);
        }

        public Builder<T> index(String indexName, Function<T, String> value, Function<T, String> sortKey) {
            indexes.put(indexName, new Index<>(indexName, value, sortKey, false));
            return this;
        }

        public Builder<T> uniqueIndex(String indexName, Function<T, String> value) {
            indexes.put(indexName, new Index<>(indexName, value, null, true));
            return this;
        }

        public DocumentCollection<T> build() {
            return new DocumentCollection<>(this);
        }
    }
}
