package com.demo.groupchat.repository;

import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.store.DocumentCollection;
import com.demo.groupchat.store.DocumentStore;
import com.demo.groupchat.store.IndexQuery;
import com.demo.groupchat.store.WriteCondition;
import com.demo.groupchat.store.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.demo.groupchat.repository.ChatCollections.MESSAGES;

@Repository
@Slf4j
public class MessageRepository {

    private final DocumentStore store;
    private final Executor ioExecutor;

    public MessageRepository(DocumentStore store, @Qualifier("ioExecutor") Executor ioExecutor) {
        this.store = store;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Insert unless a message already holds this (conversationId, timestamp) key.
     */
    public CompletableFuture<WriteResult<Message>> insert(Message message) {
        return CompletableFuture.supplyAsync(
                () -> store.put(MESSAGES, message, WriteCondition.notExists()), ioExecutor);
    }

    /**
     * Messages of a conversation in timestamp order, optionally only those after {@code since}.
     */
    public CompletableFuture<List<Message>> findByConversationId(String conversationId, String since) {
        IndexQuery query = IndexQuery.on(ChatCollections.BY_CONVERSATION, conversationId);
        IndexQuery effective = since != null ? query.after(since) : query;
        return CompletableFuture.supplyAsync(() -> store.query(MESSAGES, effective), ioExecutor);
    }

    /**
     * Rewrite the sender snapshot, guarded by "stored sender is still {@code expectedSenderId}".
     */
    public CompletableFuture<WriteResult<Message>> replaceSender(Message message, User sender,
                                                                 String expectedSenderId) {
        String key = DocumentCollection.key(message.getConversationId(), message.getTimestamp());
        return CompletableFuture.supplyAsync(() -> store.update(MESSAGES, key,
                stored -> stored.toBuilder().sender(sender).build(),
                WriteCondition.matches(stored -> expectedSenderId.equals(stored.senderId()))), ioExecutor);
    }
}
