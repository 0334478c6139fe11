package com.demo.groupchat.store;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Document-style storage backend.
 *
 * Single-document writes are atomic with their {@link WriteCondition} and with the
 * uniqueness of unique indexes. Nothing spans more than one document.
 */
public interface DocumentStore {

    <T> Optional<T> get(DocumentCollection<T> collection, String key);

    /**
     * Documents matching the index query, ordered by the index sort key.
     */
    <T> List<T> query(DocumentCollection<T> collection, IndexQuery query);

    /**
     * Insert or replace. {@code CONDITION_FAILED} when the condition rejects the stored
     * document or a unique index value belongs to another document.
     */
    <T> WriteResult<T> put(DocumentCollection<T> collection, T document, WriteCondition<T> condition);

    /**
     * Apply {@code patch} to the stored document. The condition is evaluated first;
     * if it passes but nothing is stored the result is {@code NOT_FOUND}.
     */
    <T> WriteResult<T> update(DocumentCollection<T> collection, String key,
                              UnaryOperator<T> patch, WriteCondition<T> condition);

    <T> void delete(DocumentCollection<T> collection, String key);

    boolean ping();
}
