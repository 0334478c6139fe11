package com.demo.groupchat.service;

import com.demo.groupchat.domain.Conversation;
import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.infrastructure.Futures;
import com.demo.groupchat.infrastructure.TaskDispatcher;
import com.demo.groupchat.repository.MessageRepository;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Message Service
 *
 * Posting by members only, with a copy of the sender's user record stored on each message,
 * plus per-conversation and per-user reads.
 */
@Service
@Slf4j
public class MessageService {

    private final MessageRepository messageRepository;
    private final UserDirectoryService userDirectoryService;
    private final ConversationService conversationService;
    private final TaskDispatcher taskDispatcher;
    private final MessageClock messageClock;
    private final MetricsService metricsService;
    private final int maxWriteAttempts;

    public MessageService(MessageRepository messageRepository,
                          UserDirectoryService userDirectoryService,
                          ConversationService conversationService,
                          TaskDispatcher taskDispatcher,
                          MessageClock messageClock,
                          MetricsService metricsService,
                          @Value("${chat.message.max-write-attempts:5}") int maxWriteAttempts) {
        this.messageRepository = messageRepository;
        this.userDirectoryService = userDirectoryService;
        this.conversationService = conversationService;
        this.taskDispatcher = taskDispatcher;
        this.messageClock = messageClock;
        this.metricsService = metricsService;
        this.maxWriteAttempts = maxWriteAttempts;
    }

    /**
     * Post as {@code senderId}. With {@code notify} set, a push fan-out task is dispatched
     * after the write; its outcome never reaches the caller.
     */
    public CompletableFuture<Message> post(String senderId, String conversationId, String text, boolean notify) {
        if (!StringUtils.hasText(senderId)) {
            throw ChatServiceException.invalidArgument("sender must be set");
        }
        if (!StringUtils.hasText(conversationId) || text == null) {
            throw ChatServiceException.invalidArgument("postMessage requires conversationId and message");
        }

        Timer.Sample sample = metricsService.startTimer();
        return Futures.compose(userDirectoryService.getUser(senderId), sender -> {
            if (sender.isEmpty()) {
                throw new ChatServiceException(ErrorCode.INVALID_SENDER, "Sender is not valid");
            }
            return Futures.compose(conversationService.listConversationIds(senderId), conversationIds -> {
                if (!conversationIds.contains(conversationId)) {
                    throw new ChatServiceException(ErrorCode.NOT_A_MEMBER, "Sender is not part of the conversation");
                }
                Message draft = Message.builder()
                        .conversationId(conversationId)
                        .message(text)
                        .sender(sender.get())
                        .build();
                return insertWithUniqueTimestamp(draft, 1);
            });
        }).thenApply(message -> {
            metricsService.recordMessagePosted(notify);
            log.debug("Message posted: conversationId={}, timestamp={}, sender={}",
                    conversationId, message.getTimestamp(), senderId);
            if (notify) {
                dispatchNotification(message, senderId);
            }
            return message;
        }).whenComplete((message, error) -> metricsService.stopTimer(sample, "chat.messages.post.latency",
                "outcome", error == null ? "success" : "failure"));
    }

    /**
     * Members and messages of a conversation, for a requester who is a current member.
     * With {@code since}, only messages with a later timestamp are returned.
     */
    public CompletableFuture<Conversation> getConversation(String conversationId, String requesterId, String since) {
        if (!StringUtils.hasText(conversationId) || !StringUtils.hasText(requesterId)) {
            throw ChatServiceException.invalidArgument("invalid parameters for getConversation");
        }
        return Futures.compose(conversationService.listMembers(conversationId), members -> {
            boolean isMember = members.stream().anyMatch(user -> requesterId.equals(user.getUserId()));
            if (!isMember) {
                throw new ChatServiceException(ErrorCode.NOT_A_MEMBER, "User is not part of conversation");
            }
            return messageRepository.findByConversationId(conversationId, since)
                    .thenApply(messages -> Conversation.builder()
                            .conversationId(conversationId)
                            .users(members)
                            .messages(messages)
                            .build());
        });
    }

    /**
     * Every conversation of {@code userId}. Any failed conversation fails the whole call,
     * and cancelling it cancels the outstanding per-conversation reads.
     */
    public CompletableFuture<List<Conversation>> history(String userId) {
        return Futures.compose(conversationService.listConversationIds(userId), conversationIds -> {
            List<CompletableFuture<Conversation>> reads = conversationIds.stream()
                    .map(conversationId -> Futures.attempt(() -> getConversation(conversationId, userId, null)))
                    .collect(Collectors.toList());
            return Futures.allOf(reads);
        });
    }

    private CompletableFuture<Message> insertWithUniqueTimestamp(Message draft, int attempt) {
        Message message = draft.toBuilder().timestamp(messageClock.next()).build();
        return Futures.compose(messageRepository.insert(message), result -> {
            if (result.isSuccess()) {
                return CompletableFuture.completedFuture(message);
            }
            if (attempt >= maxWriteAttempts) {
                throw ChatServiceException.upstream("Could not store message after " + attempt + " attempts", null);
            }
            log.debug("Timestamp collision: conversationId={}, timestamp={}, attempt={}",
                    message.getConversationId(), message.getTimestamp(), attempt);
            return insertWithUniqueTimestamp(draft, attempt + 1);
        });
    }

    private void dispatchNotification(Message message, String senderId) {
        try {
            taskDispatcher.dispatch(TaskRequest.sendPushNotifications(
                    message.getConversationId(), senderId, message.getMessage(), false));
        } catch (RuntimeException e) {
            log.error("Could not schedule push notifications: conversationId={}", message.getConversationId(), e);
            metricsService.recordError("NOTIFY_DISPATCH_ERROR", "MessageService");
        }
    }
}
