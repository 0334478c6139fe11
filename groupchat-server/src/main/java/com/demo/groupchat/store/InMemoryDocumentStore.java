package com.demo.groupchat.store;

import com.demo.groupchat.exception.ChatServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Single-process document store.
 *
 * Documents are kept as JSON so callers never share mutable instances with the store.
 * Writes are serialized on one monitor, which is what makes conditions and unique
 * indexes atomic here; reads go straight to the maps.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final ObjectMapper objectMapper;
    private final Map<String, Map<String, String>> tables = new ConcurrentHashMap<>();
    private final Object writeMonitor = new Object();

    public InMemoryDocumentStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        log.info("InMemoryDocumentStore initialized - data is lost on restart");
    }

    @Override
    public <T> Optional<T> get(DocumentCollection<T> collection, String key) {
        return Optional.ofNullable(decode(collection, table(collection).get(key)));
    }

    @Override
    public <T> List<T> query(DocumentCollection<T> collection, IndexQuery query) {
        DocumentCollection.Index<T> index = collection.index(query.getIndex());

        return table(collection).entrySet().stream()
                .map(entry -> new Entry<>(entry.getKey(), decode(collection, entry.getValue())))
                .filter(entry -> entry.document != null)
                .filter(entry -> Objects.equals(index.valueOf(entry.document), query.getValue()))
                .filter(entry -> query.accepts(index.sortKeyOf(entry.document)))
                .sorted(Comparator.<Entry<T>, String>comparing(entry -> index.sortKeyOf(entry.document))
                        .thenComparing(entry -> entry.key))
                .map(entry -> entry.document)
                .collect(Collectors.toList());
    }

    @Override
    public <T> WriteResult<T> put(DocumentCollection<T> collection, T document, WriteCondition<T> condition) {
        String key = collection.keyOf(document);
        Map<String, String> table = table(collection);

        synchronized (writeMonitor) {
            T current = decode(collection, table.get(key));
            if (!condition.test(current) || violatesUniqueIndex(collection, key, document)) {
                return WriteResult.conditionFailed();
            }
            String json = encode(document);
            table.put(key, json);
            return WriteResult.success(decode(collection, json));
        }
    }

    @Override
    public <T> WriteResult<T> update(DocumentCollection<T> collection, String key,
                                     UnaryOperator<T> patch, WriteCondition<T> condition) {
        Map<String, String> table = table(collection);

        synchronized (writeMonitor) {
            T current = decode(collection, table.get(key));
            if (!condition.test(current)) {
                return WriteResult.conditionFailed();
            }
            if (current == null) {
                return WriteResult.notFound();
            }
            T patched = patch.apply(current);
            if (!key.equals(collection.keyOf(patched))) {
                throw new IllegalArgumentException("Update may not change the primary key of " + key);
            }
            if (violatesUniqueIndex(collection, key, patched)) {
                return WriteResult.conditionFailed();
            }
            String json = encode(patched);
            table.put(key, json);
            return WriteResult.success(decode(collection, json));
        }
    }

    @Override
    public <T> void delete(DocumentCollection<T> collection, String key) {
        synchronized (writeMonitor) {
            table(collection).remove(key);
        }
    }

    @Override
    public boolean ping() {
        return true;
    }

    private <T> boolean violatesUniqueIndex(DocumentCollection<T> collection, String key, T document) {
        for (DocumentCollection.Index<T> index : collection.indexes()) {
            String value = index.isUnique() ? index.valueOf(document) : null;
            if (value == null) {
                continue;
            }
            boolean taken = table(collection).entrySet().stream()
                    .filter(entry -> !entry.getKey().equals(key))
                    .map(entry -> decode(collection, entry.getValue()))
                    .anyMatch(other -> other != null && value.equals(index.valueOf(other)));
            if (taken) {
                log.debug("Unique index conflict: collection={}, index={}, value={}",
                        collection.name(), index.name(), value);
                return true;
            }
        }
        return false;
    }

    private Map<String, String> table(DocumentCollection<?> collection) {
        return tables.computeIfAbsent(collection.name(), name -> new ConcurrentHashMap<>());
    }

    private String encode(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw ChatServiceException.upstream("Failed to serialize document", e);
        }
    }

    private <T> T decode(DocumentCollection<T> collection, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, collection.type());
        } catch (JsonProcessingException e) {
            throw ChatServiceException.upstream("Failed to deserialize " + collection.name() + " document", e);
        }
    }

    private static final class Entry<T> {
        private final String key;
        private final T document;

        private Entry(String key, T document) {
            this.key = key;
            this.document = document;
        }
    }
}
