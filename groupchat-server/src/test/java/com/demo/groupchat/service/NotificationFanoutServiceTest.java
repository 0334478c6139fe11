package com.demo.groupchat.service;

import com.demo.groupchat.domain.NotificationSummary;
import com.demo.groupchat.domain.PushNotification;
import com.demo.groupchat.domain.PushResult;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.infrastructure.PushGateway;
import com.demo.groupchat.infrastructure.PushSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.demo.groupchat.service.NotificationFanoutService.MissingTokenPolicy.ABORT;
import static com.demo.groupchat.service.NotificationFanoutService.MissingTokenPolicy.SKIP;
import static com.demo.groupchat.service.ServiceFixture.codeOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationFanoutServiceTest {

    private final ServiceFixture fixture = new ServiceFixture();
    private final RecordingGateway gateway = new RecordingGateway();

    private String conversationId;

    @BeforeEach
    void setUp() {
        fixture.register("a", "a@example.com", "token-a");
        fixture.register("b", "b@example.com", "token-b");
        fixture.register("c", "c@example.com", null);
        conversationId = fixture.initiate("a", "b", "c");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void skipPolicySendsToEveryMemberWithTokenExceptSender() {
        NotificationSummary summary = fixture.notifications(gateway, SKIP)
                .sendPushNotifications(conversationId, "a", "hello", false).join();

        assertEquals(List.of("token-b"), gateway.tokens);
        assertEquals(2, summary.getRecipients());
        assertEquals(1, summary.getSent());
        assertEquals(1, summary.getMissingToken());
        assertEquals(1, gateway.opened.get());
        assertEquals(1, gateway.closed.get());
    }

    @Test
    void fanOutLatencyIsTimed() {
        fixture.notifications(gateway, SKIP).sendPushNotifications(conversationId, "a", "hello", false).join();

        assertEquals(1, fixture.metricsService.getTimerCount("chat.push.fanout.latency", "outcome", "success"));
    }

    @Test
    void payloadCarriesSenderSnapshotAndText() {
        fixture.notifications(gateway, SKIP).sendPushNotifications(conversationId, "a", "hello", true).join();

        PushNotification sent = gateway.notifications.get(0);
        assertEquals(conversationId, sent.getConversationId());
        assertEquals("a", sent.getSender().getUserId());
        assertEquals("hello", sent.getMessage());
        assertEquals("Received message from user", sent.getTitle());
        assertTrue(gateway.dryRuns.get(0));
    }

    @Test
    void abortPolicyFailsWithMissingTokenAndStillClosesSession() {
        assertEquals(ErrorCode.MISSING_TOKEN, codeOf(() -> fixture.notifications(gateway, ABORT)
                .sendPushNotifications(conversationId, "a", "hello", false)));

        assertEquals(1, gateway.opened.get());
        assertEquals(1, gateway.closed.get());
    }

    @Test
    void gatewayFailuresAreCountedNotRaised() {
        gateway.failWith = new IllegalStateException("provider down");

        NotificationSummary summary = fixture.notifications(gateway, SKIP)
                .sendPushNotifications(conversationId, "c", "hello", false).join();

        assertEquals(0, summary.getSent());
        assertEquals(2, summary.getFailed());
        assertEquals(1, gateway.closed.get());
    }

    @Test
    void senderAloneProducesNoSends() {
        fixture.conversations.leave("b", conversationId).join();
        fixture.conversations.leave("c", conversationId).join();

        NotificationSummary summary = fixture.notifications(gateway, ABORT)
                .sendPushNotifications(conversationId, "a", "hello", false).join();

        assertEquals(0, summary.getRecipients());
        assertTrue(gateway.tokens.isEmpty());
    }

    static class RecordingGateway implements PushGateway {

        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final List<String> tokens = new CopyOnWriteArrayList<>();
        final List<PushNotification> notifications = new CopyOnWriteArrayList<>();
        final List<Boolean> dryRuns = new CopyOnWriteArrayList<>();
        volatile RuntimeException failWith;

        @Override
        public PushSession openSession() {
            opened.incrementAndGet();
            return new PushSession() {
                @Override
                public CompletableFuture<PushResult> send(String deviceToken, PushNotification notification,
                                                          boolean dryRun) {
                    if (failWith != null) {
                        return CompletableFuture.failedFuture(failWith);
                    }
                    tokens.add(deviceToken);
                    notifications.add(notification);
                    dryRuns.add(dryRun);
                    return CompletableFuture.completedFuture(PushResult.sent("projects/test/messages/" + tokens.size()));
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                }
            };
        }
    }
}
