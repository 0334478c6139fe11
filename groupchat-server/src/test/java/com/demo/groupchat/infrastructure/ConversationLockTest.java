package com.demo.groupchat.infrastructure;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class ConversationLockTest {

    @Test
    void fingerprintIgnoresOrderAndDuplicates() {
        assertEquals(ConversationLock.fingerprint(List.of("a", "b", "c")),
                ConversationLock.fingerprint(List.of("c", "a", "b", "a")));
        assertNotEquals(ConversationLock.fingerprint(List.of("a", "b")),
                ConversationLock.fingerprint(List.of("a", "b", "c")));
    }

    @Test
    void noLockRunsActionDirectly() {
        CompletableFuture<String> result = ConversationLock.NONE.withLock(List.of("a"),
                () -> CompletableFuture.completedFuture("done"));

        assertEquals("done", result.join());
    }
}
