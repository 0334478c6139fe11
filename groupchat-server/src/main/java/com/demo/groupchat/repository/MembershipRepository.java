package com.demo.groupchat.repository;

import com.demo.groupchat.domain.Membership;
import com.demo.groupchat.store.DocumentCollection;
import com.demo.groupchat.store.DocumentStore;
import com.demo.groupchat.store.IndexQuery;
import com.demo.groupchat.store.WriteCondition;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.demo.groupchat.repository.ChatCollections.MEMBERSHIPS;

/**
 * Repository for user/conversation memberships
 */
@Repository
public class MembershipRepository {

    private final DocumentStore store;
    private final Executor ioExecutor;

    public MembershipRepository(DocumentStore store, @Qualifier("ioExecutor") Executor ioExecutor) {
        this.store = store;
        this.ioExecutor = ioExecutor;
    }

    public CompletableFuture<List<Membership>> findByUserId(String userId) {
        return CompletableFuture.supplyAsync(
                () -> store.query(MEMBERSHIPS, IndexQuery.on(ChatCollections.BY_USER, userId)), ioExecutor);
    }

    public CompletableFuture<List<Membership>> findByConversationId(String conversationId) {
        return CompletableFuture.supplyAsync(
                () -> store.query(MEMBERSHIPS, IndexQuery.on(ChatCollections.BY_CONVERSATION, conversationId)),
                ioExecutor);
    }

    public CompletableFuture<Membership> save(Membership membership) {
        return CompletableFuture.supplyAsync(() -> {
            store.put(MEMBERSHIPS, membership, WriteCondition.none());
            return membership;
        }, ioExecutor);
    }

    public CompletableFuture<Void> delete(String userId, String conversationId) {
        return CompletableFuture.runAsync(
                () -> store.delete(MEMBERSHIPS, DocumentCollection.key(userId, conversationId)), ioExecutor);
    }
}
