package com.demo.groupchat.service;

import com.demo.groupchat.domain.NotificationSummary;
import com.demo.groupchat.domain.PushNotification;
import com.demo.groupchat.domain.PushResult;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.infrastructure.Futures;
import com.demo.groupchat.infrastructure.PushGateway;
import com.demo.groupchat.infrastructure.PushSession;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Push notification fan-out to every member of a conversation except the sender.
 *
 * Members without a device token are skipped and logged ({@code SKIP}), or abort the whole
 * fan-out with {@code MISSING_TOKEN} ({@code ABORT}); sends already started before the abort
 * are left to finish and their outcome is dropped. Provider failures for one member are
 * logged and counted, never raised.
 */
@Service
@Slf4j
public class NotificationFanoutService {

    public enum MissingTokenPolicy {
        SKIP,
        ABORT
    }

    private final ConversationService conversationService;
    private final PushGateway pushGateway;
    private final MetricsService metricsService;
    private final MissingTokenPolicy missingTokenPolicy;
    private final String title;

    public NotificationFanoutService(ConversationService conversationService,
                                     PushGateway pushGateway,
                                     MetricsService metricsService,
                                     @Value("${chat.notifications.missing-token-policy:SKIP}") MissingTokenPolicy missingTokenPolicy,
                                     @Value("${chat.notifications.title:Received message from user}") String title) {
        this.conversationService = conversationService;
        this.pushGateway = pushGateway;
        this.metricsService = metricsService;
        this.missingTokenPolicy = missingTokenPolicy;
        this.title = title;
    }

    public CompletableFuture<NotificationSummary> sendPushNotifications(String conversationId, String senderId,
                                                                        String message, boolean dryRun) {
        if (!StringUtils.hasText(conversationId) || !StringUtils.hasText(senderId)) {
            throw ChatServiceException.invalidArgument("sendPushNotifications requires conversationId and sender");
        }
        Timer.Sample sample = metricsService.startTimer();
        return Futures.compose(conversationService.listMembers(conversationId),
                members -> fanOut(conversationId, senderId, message, dryRun, members))
                .whenComplete((summary, error) -> metricsService.stopTimer(sample, "chat.push.fanout.latency",
                        "outcome", error == null ? "success" : "failure"));
    }

    private CompletableFuture<NotificationSummary> fanOut(String conversationId, String senderId, String message,
                                                          boolean dryRun, List<User> members) {
        User sender = members.stream()
                .filter(user -> senderId.equals(user.getUserId()))
                .findFirst()
                .orElseGet(() -> User.builder().userId(senderId).build());
        List<User> recipients = members.stream()
                .filter(user -> !senderId.equals(user.getUserId()))
                .collect(Collectors.toList());

        PushNotification notification = PushNotification.builder()
                .conversationId(conversationId)
                .sender(sender)
                .message(message)
                .title(title)
                .build();

        PushSession session = pushGateway.openSession();
        try {
            return sendAll(session, conversationId, recipients, notification, dryRun)
                    .whenComplete((summary, error) -> session.close());
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }

    private CompletableFuture<NotificationSummary> sendAll(PushSession session, String conversationId,
                                                           List<User> recipients, PushNotification notification,
                                                           boolean dryRun) {
        List<CompletableFuture<PushResult>> sends = new ArrayList<>();
        int missingToken = 0;

        for (User recipient : recipients) {
            if (!StringUtils.hasText(recipient.getFcmToken())) {
                if (missingTokenPolicy == MissingTokenPolicy.ABORT) {
                    throw new ChatServiceException(ErrorCode.MISSING_TOKEN,
                            "fcmToken not set for user " + recipient.getUserId() + " to sendPushNotification");
                }
                log.warn("Skipping push, no fcmToken: conversationId={}, userId={}",
                        conversationId, recipient.getUserId());
                missingToken++;
                continue;
            }
            sends.add(sendQuietly(session, recipient, notification, dryRun));
        }

        int skipped = missingToken;
        return Futures.allOf(sends).thenApply(results -> {
            int sent = (int) results.stream().filter(PushResult::isSuccess).count();
            NotificationSummary summary = NotificationSummary.builder()
                    .conversationId(conversationId)
                    .recipients(recipients.size())
                    .sent(sent)
                    .failed(results.size() - sent)
                    .missingToken(skipped)
                    .build();
            metricsService.recordNotificationFanOut(summary);
            return summary;
        });
    }

    private CompletableFuture<PushResult> sendQuietly(PushSession session, User recipient,
                                                      PushNotification notification, boolean dryRun) {
        return Futures.attempt(() -> session.send(recipient.getFcmToken(), notification, dryRun))
                .exceptionally(error -> PushResult.failed(PushResult.FailureType.UNAVAILABLE,
                        String.valueOf(ChatServiceException.unwrap(error).getMessage())))
                .thenApply(result -> {
                    if (!result.isSuccess()) {
                        log.warn("Push failed: userId={}, type={}, error={}",
                                recipient.getUserId(), result.getFailureType(), result.getErrorMessage());
                    }
                    metricsService.recordPushResult(result);
                    return result;
                });
    }
}
