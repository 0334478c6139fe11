package com.demo.groupchat.store;

import com.demo.groupchat.exception.ChatServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Redis-backed document store.
 *
 * Key layout:
 * - {collection}:{key}                 document JSON
 * - {collection}:idx:{index}:{value}   sorted set, score 0, members "{sortKey}\0{key}"
 *
 * Equal scores make Redis order index members lexicographically, which gives the
 * sort-key ordering for free. Conditional writes run as WATCH/MULTI/EXEC and are
 * retried when a watched key changes underneath them.
 */
@Slf4j
public class RedisDocumentStore implements DocumentStore {

    private static final char MEMBER_SEPARATOR = '\0';
    private static final int MAX_TX_ATTEMPTS = 10;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisDocumentStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(DocumentCollection<T> collection, String key) {
        try {
            String json = redisTemplate.opsForValue().get(documentKey(collection, key));
            return Optional.ofNullable(decode(collection, json));
        } catch (DataAccessException e) {
            log.error("Failed to get document: collection={}, key={}", collection.name(), key, e);
            throw ChatServiceException.upstream("Storage read failed", e);
        }
    }

    @Override
    public <T> List<T> query(DocumentCollection<T> collection, IndexQuery query) {
        DocumentCollection.Index<T> index = collection.index(query.getIndex());
        String indexKey = indexKey(collection, index, query.getValue());

        try {
            Set<String> members = redisTemplate.opsForZSet().range(indexKey, 0, -1);
            if (members == null || members.isEmpty()) {
                return Collections.emptyList();
            }

            List<String> documentKeys = new ArrayList<>();
            for (String member : members) {
                int separator = member.indexOf(MEMBER_SEPARATOR);
                String sortKey = member.substring(0, separator);
                if (query.accepts(sortKey)) {
                    documentKeys.add(documentKey(collection, member.substring(separator + 1)));
                }
            }
            if (documentKeys.isEmpty()) {
                return Collections.emptyList();
            }

            List<String> jsons = redisTemplate.opsForValue().multiGet(documentKeys);
            if (jsons == null) {
                return Collections.emptyList();
            }
            List<T> documents = jsons.stream()
                    .filter(Objects::nonNull)
                    .map(json -> decode(collection, json))
                    .collect(Collectors.toList());

            log.debug("Index query: collection={}, index={}, value={}, results={}",
                    collection.name(), index.name(), query.getValue(), documents.size());
            return documents;

        } catch (DataAccessException e) {
            log.error("Failed to query index: collection={}, query={}", collection.name(), query, e);
            throw ChatServiceException.upstream("Storage query failed", e);
        }
    }

    @Override
    public <T> WriteResult<T> put(DocumentCollection<T> collection, T document, WriteCondition<T> condition) {
        return write(collection, collection.keyOf(document), condition, current -> document, false);
    }

    @Override
    public <T> WriteResult<T> update(DocumentCollection<T> collection, String key,
                                     UnaryOperator<T> patch, WriteCondition<T> condition) {
        return write(collection, key, condition, patch, true);
    }

    @Override
    public <T> void delete(DocumentCollection<T> collection, String key) {
        String docKey = documentKey(collection, key);

        for (int attempt = 1; attempt <= MAX_TX_ATTEMPTS; attempt++) {
            Boolean done = executeTransaction(new SessionCallback<Boolean>() {
                @Override
                @SuppressWarnings({"unchecked", "rawtypes"})
                public Boolean execute(RedisOperations operations) throws DataAccessException {
                    operations.watch(docKey);
                    T current = decode(collection, (String) operations.opsForValue().get(docKey));
                    if (current == null) {
                        operations.unwatch();
                        return Boolean.TRUE;
                    }

                    operations.multi();
                    operations.delete(docKey);
                    removeIndexEntries(operations, collection, key, current);
                    List<Object> results = operations.exec();
                    return committed(results) ? Boolean.TRUE : null;
                }
            });

            if (done != null) {
                log.debug("Deleted document: collection={}, key={}", collection.name(), key);
                return;
            }
            log.debug("Delete raced with another writer: collection={}, key={}, attempt={}",
                    collection.name(), key, attempt);
        }
        throw ChatServiceException.upstream("Delete did not converge for " + docKey, null);
    }

    @Override
    public boolean ping() {
        try {
            redisTemplate.getConnectionFactory().getConnection().ping();
            return true;
        } catch (Exception e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> WriteResult<T> write(DocumentCollection<T> collection, String key, WriteCondition<T> condition,
                                     UnaryOperator<T> transform, boolean requireExisting) {
        String docKey = documentKey(collection, key);

        for (int attempt = 1; attempt <= MAX_TX_ATTEMPTS; attempt++) {
            WriteResult<T> result = executeTransaction(new SessionCallback<WriteResult<T>>() {
                @Override
                @SuppressWarnings({"unchecked", "rawtypes"})
                public WriteResult<T> execute(RedisOperations operations) throws DataAccessException {
                    operations.watch(docKey);
                    T current = decode(collection, (String) operations.opsForValue().get(docKey));

                    if (!condition.test(current)) {
                        operations.unwatch();
                        return WriteResult.conditionFailed();
                    }
                    if (requireExisting && current == null) {
                        operations.unwatch();
                        return WriteResult.notFound();
                    }

                    T next = transform.apply(current);
                    if (!key.equals(collection.keyOf(next))) {
                        operations.unwatch();
                        throw new IllegalArgumentException("Write may not change the primary key of " + key);
                    }
                    if (uniqueIndexTaken(operations, collection, key, next)) {
                        operations.unwatch();
                        return WriteResult.conditionFailed();
                    }

                    String json = encode(next);
                    operations.multi();
                    operations.opsForValue().set(docKey, json);
                    if (current != null) {
                        removeIndexEntries(operations, collection, key, current);
                    }
                    addIndexEntries(operations, collection, key, next);
                    List<Object> results = operations.exec();
                    return committed(results) ? WriteResult.success(next) : null;
                }
            });

            if (result != null) {
                log.debug("Write finished: collection={}, key={}, status={}",
                        collection.name(), key, result.getStatus());
                return result;
            }
            log.debug("Write raced with another writer: collection={}, key={}, attempt={}",
                    collection.name(), key, attempt);
        }
        throw ChatServiceException.upstream("Write did not converge for " + docKey, null);
    }

    private <R> R executeTransaction(SessionCallback<R> callback) {
        try {
            return redisTemplate.execute(callback);
        } catch (DataAccessException e) {
            log.error("Redis transaction failed", e);
            throw ChatServiceException.upstream("Storage write failed", e);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <T> boolean uniqueIndexTaken(RedisOperations operations, DocumentCollection<T> collection,
                                         String key, T document) {
        for (DocumentCollection.Index<T> index : collection.indexes()) {
            String value = index.isUnique() ? index.valueOf(document) : null;
            if (value == null) {
                continue;
            }
            String indexKey = indexKey(collection, index, value);
            operations.watch(indexKey);
            Set<String> owners = operations.opsForZSet().range(indexKey, 0, -1);
            if (owners == null) {
                continue;
            }
            for (String owner : owners) {
                if (!owner.substring(owner.indexOf(MEMBER_SEPARATOR) + 1).equals(key)) {
                    log.debug("Unique index conflict: collection={}, index={}, value={}",
                            collection.name(), index.name(), value);
                    return true;
                }
            }
        }
        return false;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <T> void addIndexEntries(RedisOperations operations, DocumentCollection<T> collection,
                                     String key, T document) {
        for (DocumentCollection.Index<T> index : collection.indexes()) {
            String value = index.valueOf(document);
            if (value != null) {
                operations.opsForZSet().add(indexKey(collection, index, value),
                        member(index.sortKeyOf(document), key), 0);
            }
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <T> void removeIndexEntries(RedisOperations operations, DocumentCollection<T> collection,
                                        String key, T document) {
        for (DocumentCollection.Index<T> index : collection.indexes()) {
            String value = index.valueOf(document);
            if (value != null) {
                operations.opsForZSet().remove(indexKey(collection, index, value),
                        member(index.sortKeyOf(document), key));
            }
        }
    }

    private static boolean committed(List<Object> results) {
        // an aborted EXEC comes back null or empty; every transaction here queues commands
        return results != null && !results.isEmpty();
    }

    private static String documentKey(DocumentCollection<?> collection, String key) {
        return collection.name() + ":" + key;
    }

    private static <T> String indexKey(DocumentCollection<T> collection, DocumentCollection.Index<T> index,
                                       String value) {
        return collection.name() + ":idx:" + index.name() + ":" + value;
    }

    private static String member(String sortKey, String key) {
        return sortKey + MEMBER_SEPARATOR + key;
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
}
