package com.demo.groupchat.infrastructure;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Mutual exclusion around "find or create" for one participant set.
 */
public interface ConversationLock {

    /** Runs the action directly. */
    ConversationLock NONE = new ConversationLock() {
        @Override
        public <T> CompletableFuture<T> withLock(Collection<String> participants,
                                                 Supplier<CompletableFuture<T>> action) {
            return Futures.attempt(action);
        }
    };

    <T> CompletableFuture<T> withLock(Collection<String> participants, Supplier<CompletableFuture<T>> action);

    /**
     * Order-independent key for a participant set.
     */
    static String fingerprint(Collection<String> participants) {
        String joined = String.join(",", participants.stream().sorted().distinct().toList());
        return DigestUtils.md5DigestAsHex(joined.getBytes(StandardCharsets.UTF_8));
    }
}
