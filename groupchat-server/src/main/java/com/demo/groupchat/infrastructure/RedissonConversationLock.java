package com.demo.groupchat.infrastructure;

import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Redisson lock keyed by the participant fingerprint.
 *
 * The action completes on pool threads, so the lock is taken and released with an
 * explicit owner id instead of the calling thread.
 */
@Slf4j
public class RedissonConversationLock implements ConversationLock {

    private static final String LOCK_PREFIX = "lock:conversation:";

    private final RedissonClient redissonClient;
    private final Duration waitTime;
    private final Duration leaseTime;

    public RedissonConversationLock(RedissonClient redissonClient, Duration waitTime, Duration leaseTime) {
        this.redissonClient = redissonClient;
        this.waitTime = waitTime;
        this.leaseTime = leaseTime;
    }

    @Override
    public <T> CompletableFuture<T> withLock(Collection<String> participants, Supplier<CompletableFuture<T>> action) {
        String key = LOCK_PREFIX + ConversationLock.fingerprint(participants);
        RLock lock = redissonClient.getLock(key);
        long owner = ThreadLocalRandom.current().nextLong();

        return lock.tryLockAsync(waitTime.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS, owner)
                .toCompletableFuture()
                .thenCompose(acquired -> {
                    if (!Boolean.TRUE.equals(acquired)) {
                        throw new ChatServiceException(ErrorCode.UPSTREAM,
                                "Timed out waiting for conversation lock");
                    }
                    log.debug("🔒 Lock acquired: key={}", key);
                    return Futures.attempt(action).whenComplete((result, error) ->
                            lock.unlockAsync(owner).whenComplete((ignored, unlockError) -> {
                                if (unlockError != null) {
                                    log.warn("⚠️ Failed to release lock: key={}", key, unlockError);
                                } else {
                                    log.debug("🔓 Lock released: key={}", key);
                                }
                            }));
                });
    }
}
