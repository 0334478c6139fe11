package com.demo.groupchat.infrastructure;

import com.demo.groupchat.exception.ChatServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Joins for fanned-out I/O.
 *
 * - allOf: wait for all, fail on the first failure and cancel the siblings
 * - compose: thenCompose that forwards cancellation to the stage it started
 * - attempt: turn a synchronous throw into a failed future
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Results in input order. The first failure completes the aggregate and cancels the
     * remaining children; cancelling the aggregate cancels every child.
     */
    public static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> futures) {
        CompletableFuture<List<T>> aggregate = new CompletableFuture<>();
        if (futures.isEmpty()) {
            aggregate.complete(new ArrayList<>());
            return aggregate;
        }

        AtomicInteger remaining = new AtomicInteger(futures.size());
        for (CompletableFuture<T> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null) {
                    if (aggregate.completeExceptionally(ChatServiceException.unwrap(error))) {
                        futures.forEach(sibling -> sibling.cancel(true));
                    }
                } else if (remaining.decrementAndGet() == 0) {
                    List<T> results = new ArrayList<>(futures.size());
                    futures.forEach(done -> results.add(done.join()));
                    aggregate.complete(results);
                }
            });
        }

        aggregate.whenComplete((value, error) -> {
            if (aggregate.isCancelled()) {
                futures.forEach(child -> child.cancel(true));
            }
        });
        return aggregate;
    }

    /**
     * Like {@code source.thenCompose(next)}, except that cancelling the returned future also
     * cancels {@code source} and whatever stage {@code next} produced.
     */
    public static <T, U> CompletableFuture<U> compose(CompletableFuture<T> source,
                                                      Function<T, CompletableFuture<U>> next) {
        CompletableFuture<U> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<U>> inner = new AtomicReference<>();

        source.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(ChatServiceException.unwrap(error));
                return;
            }
            if (result.isDone()) {
                return;
            }
            CompletableFuture<U> stage = attempt(() -> next.apply(value));
            inner.set(stage);
            stage.whenComplete((u, stageError) -> {
                if (stageError != null) {
                    result.completeExceptionally(ChatServiceException.unwrap(stageError));
                } else {
                    result.complete(u);
                }
            });
            if (result.isCancelled()) {
                stage.cancel(true);
            }
        });

        result.whenComplete((u, error) -> {
            if (result.isCancelled()) {
                source.cancel(true);
                CompletableFuture<U> stage = inner.get();
                if (stage != null) {
                    stage.cancel(true);
                }
            }
        });
        return result;
    }

    public static <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
