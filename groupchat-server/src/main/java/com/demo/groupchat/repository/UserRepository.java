package com.demo.groupchat.repository;

import com.demo.groupchat.domain.User;
import com.demo.groupchat.store.DocumentStore;
import com.demo.groupchat.store.IndexQuery;
import com.demo.groupchat.store.WriteCondition;
import com.demo.groupchat.store.WriteResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

import static com.demo.groupchat.repository.ChatCollections.USERS;

/**
 * Repository for User records
 */
@Repository
public class UserRepository {

    private final DocumentStore store;
    private final Executor ioExecutor;

    public UserRepository(DocumentStore store, @Qualifier("ioExecutor") Executor ioExecutor) {
        this.store = store;
        this.ioExecutor = ioExecutor;
    }

    public CompletableFuture<Optional<User>> findById(String userId) {
        return CompletableFuture.supplyAsync(() -> store.get(USERS, userId), ioExecutor);
    }

    public CompletableFuture<Optional<User>> findFirstByPhoneNumber(String phoneNumber) {
        return findFirst(ChatCollections.BY_PHONE, phoneNumber);
    }

    public CompletableFuture<Optional<User>> findFirstByEmail(String email) {
        return findFirst(ChatCollections.BY_EMAIL, email);
    }

    /**
     * Insert only if no user with this userId exists and the phone/email are unclaimed.
     */
    public CompletableFuture<WriteResult<User>> insert(User user) {
        return CompletableFuture.supplyAsync(
                () -> store.put(USERS, user, WriteCondition.notExists()), ioExecutor);
    }

    /**
     * Patch an existing user; {@code CONDITION_FAILED} when the user does not exist.
     */
    public CompletableFuture<WriteResult<User>> updateExisting(String userId, UnaryOperator<User> patch) {
        return CompletableFuture.supplyAsync(
                () -> store.update(USERS, userId, patch, WriteCondition.exists()), ioExecutor);
    }

    public CompletableFuture<Void> deleteById(String userId) {
        return CompletableFuture.runAsync(() -> store.delete(USERS, userId), ioExecutor);
    }

    private CompletableFuture<Optional<User>> findFirst(String index, String value) {
        return CompletableFuture.supplyAsync(() -> {
            List<User> users = store.query(USERS, IndexQuery.on(index, value));
            return users.stream().findFirst();
        }, ioExecutor);
    }
}
