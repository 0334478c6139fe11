package com.demo.groupchat.service;

import com.demo.groupchat.domain.Conversation;
import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.RepairSummary;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.infrastructure.Futures;
import com.demo.groupchat.repository.MessageRepository;
import com.demo.groupchat.store.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Rewrites the sender copy on a user's past messages after their profile changed.
 *
 * Each rewrite is conditional on the stored sender still being that user; a failed
 * condition is counted as skipped. Storage errors fail the run.
 */
@Service
@Slf4j
public class SenderSnapshotRepairService {

    private final UserDirectoryService userDirectoryService;
    private final MessageService messageService;
    private final MessageRepository messageRepository;
    private final MetricsService metricsService;

    public SenderSnapshotRepairService(UserDirectoryService userDirectoryService,
                                       MessageService messageService,
                                       MessageRepository messageRepository,
                                       MetricsService metricsService) {
        this.userDirectoryService = userDirectoryService;
        this.messageService = messageService;
        this.messageRepository = messageRepository;
        this.metricsService = metricsService;
    }

    public CompletableFuture<RepairSummary> repairSenderSnapshots(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ChatServiceException.invalidArgument("repairSenderSnapshots requires userId");
        }
        log.info("Updating user {} in all their message history", userId);

        return Futures.compose(userDirectoryService.getUser(userId), user -> {
            if (user.isEmpty()) {
                log.warn("User {} no longer exists, nothing to repair", userId);
                return CompletableFuture.completedFuture(RepairSummary.empty(userId));
            }
            return Futures.compose(messageService.history(userId),
                    conversations -> rewrite(user.get(), conversations));
        }).thenApply(summary -> {
            metricsService.recordSnapshotRepair(summary);
            return summary;
        });
    }

    private CompletableFuture<RepairSummary> rewrite(User user, List<Conversation> conversations) {
        List<Message> messages = conversations.stream()
                .flatMap(conversation -> conversation.getMessages().stream())
                .collect(Collectors.toList());
        List<Message> owned = messages.stream()
                .filter(message -> user.getUserId().equals(message.senderId()))
                .collect(Collectors.toList());

        List<CompletableFuture<WriteResult<Message>>> updates = owned.stream()
                .map(message -> messageRepository.replaceSender(message, user, user.getUserId()))
                .collect(Collectors.toList());

        return Futures.allOf(updates).thenApply(results -> {
            int updated = (int) results.stream().filter(WriteResult::isSuccess).count();
            return RepairSummary.builder()
                    .userId(user.getUserId())
                    .examined(messages.size())
                    .updated(updated)
                    .skipped(results.size() - updated)
                    .build();
        });
    }
}
