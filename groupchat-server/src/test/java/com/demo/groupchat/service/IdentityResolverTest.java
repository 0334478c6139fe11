package com.demo.groupchat.service;

import com.demo.groupchat.domain.CallerIdentity;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IdentityResolverTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hmac-sha-256";

    private final MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
    private final IdentityResolver resolver = new IdentityResolver(SECRET, 60_000, metricsService);

    @Test
    void resolvesClaimsFromBearerToken() {
        CallerIdentity issued = CallerIdentity.builder()
                .userId("u1")
                .email("ann@example.com")
                .phoneNumber("+12015550123")
                .displayName("Ann")
                .build();

        CallerIdentity resolved = resolver.resolve("Bearer " + resolver.generateToken(issued));

        assertEquals(issued, resolved);
        assertEquals(1.0, metricsService.getCounterValue("chat.auth.attempts", "success", "true"));
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        IdentityResolver other = new IdentityResolver(SECRET + "-other", 60_000, metricsService);
        String token = other.generateToken(CallerIdentity.builder().userId("u1").build());

        ChatServiceException e = assertThrows(ChatServiceException.class, () -> resolver.resolve("Bearer " + token));

        assertEquals(ErrorCode.UNAUTHENTICATED, e.getCode());
    }

    @Test
    void rejectsExpiredToken() {
        IdentityResolver shortLived = new IdentityResolver(SECRET, -1_000, metricsService);
        String token = shortLived.generateToken(CallerIdentity.builder().userId("u1").build());

        ChatServiceException e = assertThrows(ChatServiceException.class, () -> resolver.resolve(token));

        assertEquals(ErrorCode.UNAUTHENTICATED, e.getCode());
    }

    @Test
    void rejectsMissingOrGarbageHeader() {
        assertEquals(ErrorCode.UNAUTHENTICATED, assertThrows(ChatServiceException.class,
                () -> resolver.resolve(null)).getCode());
        assertEquals(ErrorCode.UNAUTHENTICATED, assertThrows(ChatServiceException.class,
                () -> resolver.resolve("Bearer not.a.jwt")).getCode());
    }
}
