package com.demo.groupchat.controller;

import com.demo.groupchat.domain.CallerIdentity;
import com.demo.groupchat.domain.Conversation;
import com.demo.groupchat.domain.InitiateConversationRequest;
import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.PostMessageRequest;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.service.ConversationService;
import com.demo.groupchat.service.IdentityResolver;
import com.demo.groupchat.service.MessageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Conversation Controller
 * Conversations, membership and messages, always acting as the authenticated caller.
 */
@Slf4j
@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final IdentityResolver identityResolver;

    public ConversationController(ConversationService conversationService, MessageService messageService,
                                  IdentityResolver identityResolver) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.identityResolver = identityResolver;
    }

    @GetMapping
    public CompletableFuture<List<String>> listConversationIds(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return conversationService.listConversationIds(caller.getUserId());
    }

    /**
     * POST /api/conversations
     * Returns the id of the conversation between the caller and {@code others}, reusing an
     * existing one with exactly those members.
     */
    @PostMapping
    public CompletableFuture<Map<String, Object>> initiate(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody InitiateConversationRequest request) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        log.info("Initiate conversation: userId={}, others={}", caller.getUserId(), request.getOthers());
        return conversationService.initiate(caller.getUserId(), request.getOthers())
                .thenApply(conversationId -> Map.of("conversationId", conversationId));
    }

    /**
     * GET /api/conversations/history
     */
    @GetMapping("/history")
    public CompletableFuture<List<Conversation>> history(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return messageService.history(caller.getUserId());
    }

    /**
     * GET /api/conversations/{conversationId}?since=2024-01-01T00:00:00.000Z
     */
    @GetMapping("/{conversationId}")
    public CompletableFuture<Conversation> getConversation(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId,
            @RequestParam(required = false) String since) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return messageService.getConversation(conversationId, caller.getUserId(), since);
    }

    @GetMapping("/{conversationId}/members")
    public CompletableFuture<List<User>> listMembers(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        identityResolver.resolve(authorization);
        return conversationService.listMembers(conversationId);
    }

    @PostMapping("/{conversationId}/members")
    public CompletableFuture<ResponseEntity<Void>> join(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return conversationService.join(caller.getUserId(), conversationId)
                .thenApply(ignored -> ResponseEntity.noContent().<Void>build());
    }

    @DeleteMapping("/{conversationId}/members")
    public CompletableFuture<ResponseEntity<Void>> leave(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return conversationService.leave(caller.getUserId(), conversationId)
                .thenApply(ignored -> ResponseEntity.noContent().<Void>build());
    }

    /**
     * POST /api/conversations/{conversationId}/messages
     */
    @PostMapping("/{conversationId}/messages")
    public CompletableFuture<ResponseEntity<Message>> postMessage(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String conversationId,
            @RequestBody PostMessageRequest request) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return messageService.post(caller.getUserId(), conversationId, request.getMessage(),
                        request.isEnablePushNotifications())
                .thenApply(message -> ResponseEntity.status(HttpStatus.CREATED).body(message));
    }
}
