package com.demo.groupchat.service;

import com.demo.groupchat.domain.Membership;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.infrastructure.ConversationLock;
import com.demo.groupchat.infrastructure.Futures;
import com.demo.groupchat.repository.MembershipRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Conversation Resolver
 *
 * A conversation is the set of membership rows sharing a conversationId. Creation
 * reuses an existing conversation whose members are exactly the requested participants.
 * Check-then-create is not atomic unless the dedupe lock is enabled, and a failed
 * membership write leaves the rows already written in place.
 */
@Service
@Slf4j
public class ConversationService {

    private final MembershipRepository membershipRepository;
    private final UserDirectoryService userDirectoryService;
    private final ConversationLock conversationLock;
    private final MetricsService metricsService;

    public ConversationService(MembershipRepository membershipRepository,
                               UserDirectoryService userDirectoryService,
                               ConversationLock conversationLock,
                               MetricsService metricsService) {
        this.membershipRepository = membershipRepository;
        this.userDirectoryService = userDirectoryService;
        this.conversationLock = conversationLock;
        this.metricsService = metricsService;
    }

    public CompletableFuture<List<String>> listConversationIds(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ChatServiceException.invalidArgument("listConversationIds requires userId");
        }
        return membershipRepository.findByUserId(userId).thenApply(memberships -> memberships.stream()
                .map(Membership::getConversationId)
                .collect(Collectors.toList()));
    }

    /**
     * Current members resolved to user records. Members whose user record no longer
     * exists are left out.
     */
    public CompletableFuture<List<User>> listMembers(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            throw ChatServiceException.invalidArgument("listMembers requires conversationId");
        }
        return Futures.compose(listMemberIds(conversationId), memberIds -> {
            List<CompletableFuture<Optional<User>>> lookups = memberIds.stream()
                    .map(userDirectoryService::getUser)
                    .collect(Collectors.toList());
            return Futures.allOf(lookups).thenApply(users -> {
                List<User> resolved = new ArrayList<>();
                for (int i = 0; i < users.size(); i++) {
                    if (users.get(i).isPresent()) {
                        resolved.add(users.get(i).get());
                    } else {
                        log.debug("Member without user record: conversationId={}, userId={}",
                                conversationId, memberIds.get(i));
                    }
                }
                return resolved;
            });
        });
    }

    /**
     * The single conversation every given user belongs to. Empty when there is none or
     * when more than one qualifies.
     */
    public CompletableFuture<Optional<String>> findSharedConversation(Collection<String> userIds) {
        return sharedConversationIds(userIds).thenApply(shared ->
                shared.size() == 1 ? Optional.of(shared.iterator().next()) : Optional.empty());
    }

    /**
     * Conversation id for exactly {@code initiatorId} plus {@code otherUserIds}, created if needed.
     */
    public CompletableFuture<String> initiate(String initiatorId, List<String> otherUserIds) {
        if (!StringUtils.hasText(initiatorId)) {
            throw ChatServiceException.invalidArgument("Invalid parameters to call initiateConversation");
        }
        if (otherUserIds == null || otherUserIds.isEmpty()) {
            throw ChatServiceException.invalidArgument("initiateConversation requires a non-empty list of users");
        }
        if (otherUserIds.stream().anyMatch(id -> !StringUtils.hasText(id))) {
            throw ChatServiceException.invalidArgument("initiateConversation received a blank userId");
        }
        if (otherUserIds.contains(initiatorId)) {
            throw ChatServiceException.invalidArgument("You should not talk to yourself");
        }

        Set<String> participants = new LinkedHashSet<>();
        participants.add(initiatorId);
        participants.addAll(otherUserIds);

        return Futures.compose(userDirectoryService.validateUserIds(new ArrayList<>(participants)), valid -> {
            if (!valid) {
                throw ChatServiceException.invalidArgument("UserIds not valid");
            }
            return conversationLock.withLock(participants, () -> findOrCreate(participants));
        });
    }

    /**
     * Adds {@code userId} to an existing conversation. A conversation with no remaining
     * members counts as nonexistent and fails with {@code NOT_FOUND} instead of being
     * recreated; an existing member fails with {@code ALREADY_MEMBER}.
     */
    public CompletableFuture<Void> join(String userId, String conversationId) {
        requireIds(userId, conversationId, "joinConversation");
        return Futures.compose(listMemberIds(conversationId), memberIds -> {
            if (memberIds.isEmpty()) {
                throw ChatServiceException.notFound("Conversation " + conversationId + " does not exist");
            }
            if (memberIds.contains(userId)) {
                throw new ChatServiceException(ErrorCode.ALREADY_MEMBER, "User is already a member of this conversation");
            }
            return membershipRepository.save(new Membership(userId, conversationId))
                    .thenRun(() -> log.info("User joined conversation: userId={}, conversationId={}",
                            userId, conversationId));
        });
    }

    public CompletableFuture<Void> leave(String userId, String conversationId) {
        requireIds(userId, conversationId, "leaveConversation");
        return Futures.compose(listMemberIds(conversationId), memberIds -> {
            if (!memberIds.contains(userId)) {
                throw new ChatServiceException(ErrorCode.NOT_MEMBER, "User is not a member of this conversation");
            }
            return membershipRepository.delete(userId, conversationId)
                    .thenRun(() -> log.info("User left conversation: userId={}, conversationId={}",
                            userId, conversationId));
        });
    }

    CompletableFuture<List<String>> listMemberIds(String conversationId) {
        return membershipRepository.findByConversationId(conversationId).thenApply(memberships -> memberships.stream()
                .map(Membership::getUserId)
                .collect(Collectors.toList()));
    }

    private CompletableFuture<String> findOrCreate(Set<String> participants) {
        return Futures.compose(findExactConversation(participants), existing -> {
            if (existing.isPresent()) {
                log.info("Reusing conversation: conversationId={}, participants={}", existing.get(), participants.size());
                metricsService.recordConversationInitiated(true);
                return CompletableFuture.completedFuture(existing.get());
            }
            return create(participants);
        });
    }

    /**
     * Among the conversations shared by all participants, the one whose members are exactly
     * the participants. Duplicates left by concurrent creation resolve to the smallest id.
     */
    private CompletableFuture<Optional<String>> findExactConversation(Set<String> participants) {
        return Futures.compose(sharedConversationIds(participants), shared -> {
            List<String> candidates = new ArrayList<>(shared);
            List<CompletableFuture<List<String>>> memberLists = candidates.stream()
                    .map(this::listMemberIds)
                    .collect(Collectors.toList());
            return Futures.allOf(memberLists).thenApply(members -> {
                String match = null;
                for (int i = 0; i < candidates.size(); i++) {
                    boolean exact = members.get(i).size() == participants.size()
                            && participants.containsAll(members.get(i));
                    if (exact && (match == null || candidates.get(i).compareTo(match) < 0)) {
                        match = candidates.get(i);
                    }
                }
                return Optional.ofNullable(match);
            });
        });
    }

    private CompletableFuture<Set<String>> sharedConversationIds(Collection<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return CompletableFuture.completedFuture(new LinkedHashSet<>());
        }
        List<CompletableFuture<List<String>>> perUser = userIds.stream()
                .map(this::listConversationIds)
                .collect(Collectors.toList());
        return Futures.allOf(perUser).thenApply(lists -> {
            Set<String> shared = new LinkedHashSet<>(lists.get(0));
            lists.subList(1, lists.size()).forEach(shared::retainAll);
            return shared;
        });
    }

    private CompletableFuture<String> create(Set<String> participants) {
        String conversationId = UUID.randomUUID().toString();
        List<CompletableFuture<Membership>> writes = participants.stream()
                .map(userId -> membershipRepository.save(new Membership(userId, conversationId)))
                .collect(Collectors.toList());
        return Futures.allOf(writes).thenApply(saved -> {
            log.info("Conversation created: conversationId={}, participants={}", conversationId, saved.size());
            metricsService.recordConversationInitiated(false);
            return conversationId;
        });
    }

    private static void requireIds(String userId, String conversationId, String operation) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(conversationId)) {
            throw ChatServiceException.invalidArgument(operation + " requires userId and conversationId");
        }
    }
}
