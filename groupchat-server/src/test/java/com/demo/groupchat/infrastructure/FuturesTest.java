package com.demo.groupchat.infrastructure;

import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuturesTest {

    @Test
    void allOfKeepsInputOrder() {
        CompletableFuture<String> slow = new CompletableFuture<>();
        CompletableFuture<String> fast = CompletableFuture.completedFuture("fast");

        CompletableFuture<List<String>> all = Futures.allOf(List.of(slow, fast));
        slow.complete("slow");

        assertEquals(List.of("slow", "fast"), all.join());
    }

    @Test
    void allOfOfNothingIsEmpty() {
        assertTrue(Futures.<String>allOf(List.of()).join().isEmpty());
    }

    @Test
    void firstFailureFailsAggregateAndCancelsSiblings() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> failing = new CompletableFuture<>();
        ChatServiceException failure = ChatServiceException.notFound("gone");

        CompletableFuture<List<String>> all = Futures.allOf(List.of(pending, failing));
        failing.completeExceptionally(new CompletionException(failure));

        CompletionException thrown = assertThrows(CompletionException.class, all::join);
        assertSame(failure, thrown.getCause());
        assertTrue(pending.isCancelled());
    }

    @Test
    void cancellingAggregateCancelsChildren() {
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();

        Futures.allOf(List.of(first, second)).cancel(true);

        assertTrue(first.isCancelled());
        assertTrue(second.isCancelled());
    }

    @Test
    void cancellingComposedFutureReachesInnerStage() {
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<String> inner = new CompletableFuture<>();

        CompletableFuture<String> composed = Futures.compose(source, value -> inner);
        source.complete("ready");
        composed.cancel(true);

        assertTrue(inner.isCancelled());
    }

    @Test
    void cancellingComposedFutureBeforeSourceCompletesCancelsSource() {
        CompletableFuture<String> source = new CompletableFuture<>();

        Futures.compose(source, value -> CompletableFuture.completedFuture(value)).cancel(true);

        assertTrue(source.isCancelled());
    }

    @Test
    void composeTurnsSynchronousThrowIntoFailure() {
        CompletableFuture<String> composed = Futures.compose(CompletableFuture.completedFuture("x"), value -> {
            throw ChatServiceException.invalidArgument("bad " + value);
        });

        CompletionException thrown = assertThrows(CompletionException.class, composed::join);
        assertTrue(ChatServiceException.hasCode(thrown, ErrorCode.INVALID_ARGUMENT));
    }
}
