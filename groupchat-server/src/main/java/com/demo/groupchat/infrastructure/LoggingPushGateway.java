package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.PushNotification;
import com.demo.groupchat.domain.PushResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Used when no push provider is configured: every send is logged and reported as sent.
 */
@Slf4j
public class LoggingPushGateway implements PushGateway {

    @Override
    public PushSession openSession() {
        return new PushSession() {
            @Override
            public CompletableFuture<PushResult> send(String deviceToken, PushNotification notification, boolean dryRun) {
                log.info("📲 Push (log only): conversationId={}, sender={}, dryRun={}",
                        notification.getConversationId(),
                        notification.getSender() != null ? notification.getSender().getUserId() : null,
                        dryRun);
                return CompletableFuture.completedFuture(PushResult.sent("log-only"));
            }

            @Override
            public void close() {
                log.debug("Push session closed (log only)");
            }
        };
    }
}
