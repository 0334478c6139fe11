package com.demo.groupchat.controller;

import com.demo.groupchat.domain.CallerIdentity;
import com.demo.groupchat.domain.RegisterUserRequest;
import com.demo.groupchat.domain.UpdateUserRequest;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.service.IdentityResolver;
import com.demo.groupchat.service.UserDirectoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * User Controller
 * Registration and profile operations for the authenticated caller, plus lookups.
 */
@Slf4j
@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserDirectoryService userDirectoryService;
    private final IdentityResolver identityResolver;

    public UserController(UserDirectoryService userDirectoryService, IdentityResolver identityResolver) {
        this.userDirectoryService = userDirectoryService;
        this.identityResolver = identityResolver;
    }

    /**
     * POST /api/users/register/email
     * Email and display name default to the token's claims.
     */
    @PostMapping("/register/email")
    public CompletableFuture<ResponseEntity<User>> registerWithEmail(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody(required = false) RegisterUserRequest request) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        RegisterUserRequest body = request != null ? request : new RegisterUserRequest();
        log.info("Register with email: userId={}", caller.getUserId());
        return userDirectoryService.registerWithEmail(
                        caller.getUserId(),
                        firstNonBlank(body.getEmail(), caller.getEmail()),
                        firstNonBlank(body.getDisplayName(), caller.getDisplayName()),
                        body.getFcmToken())
                .thenApply(user -> ResponseEntity.status(HttpStatus.CREATED).body(user));
    }

    /**
     * POST /api/users/register/phone
     * Phone number and display name default to the token's claims.
     */
    @PostMapping("/register/phone")
    public CompletableFuture<ResponseEntity<User>> registerWithPhone(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody(required = false) RegisterUserRequest request) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        RegisterUserRequest body = request != null ? request : new RegisterUserRequest();
        log.info("Register with phone: userId={}", caller.getUserId());
        return userDirectoryService.registerWithPhone(
                        caller.getUserId(),
                        firstNonBlank(body.getPhoneNumber(), caller.getPhoneNumber()),
                        firstNonBlank(body.getDisplayName(), caller.getDisplayName()),
                        body.getFcmToken())
                .thenApply(user -> ResponseEntity.status(HttpStatus.CREATED).body(user));
    }

    /**
     * POST /api/users/register/batch
     */
    @PostMapping("/register/batch")
    public CompletableFuture<ResponseEntity<List<User>>> registerUsers(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody List<RegisterUserRequest> requests) {
        identityResolver.resolve(authorization);
        return userDirectoryService.registerUsers(requests)
                .thenApply(users -> ResponseEntity.status(HttpStatus.CREATED).body(users));
    }

    /**
     * GET /api/users/lookup?phoneNumber=... or ?email=...
     */
    @GetMapping("/lookup")
    public CompletableFuture<ResponseEntity<User>> lookup(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestParam(required = false) String phoneNumber,
            @RequestParam(required = false) String email) {
        identityResolver.resolve(authorization);
        CompletableFuture<Optional<User>> lookup;
        if (StringUtils.hasText(phoneNumber)) {
            lookup = userDirectoryService.lookupByPhone(phoneNumber);
        } else if (StringUtils.hasText(email)) {
            lookup = userDirectoryService.lookupByEmail(email);
        } else {
            throw ChatServiceException.invalidArgument("lookup requires phoneNumber or email");
        }
        return lookup.thenApply(UserController::okOrNotFound);
    }

    @GetMapping("/{userId}")
    public CompletableFuture<ResponseEntity<User>> getUser(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @PathVariable String userId) {
        identityResolver.resolve(authorization);
        return userDirectoryService.getUser(userId).thenApply(UserController::okOrNotFound);
    }

    /**
     * POST /api/users/validate
     * {"valid": true} only when every id in the body is a registered user.
     */
    @PostMapping("/validate")
    public CompletableFuture<Map<String, Object>> validateUserIds(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody List<String> userIds) {
        identityResolver.resolve(authorization);
        return userDirectoryService.validateUserIds(userIds).thenApply(valid -> Map.of("valid", valid));
    }

    @PatchMapping("/me")
    public CompletableFuture<User> updateUser(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
            @RequestBody UpdateUserRequest request) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return userDirectoryService.updateUser(caller.getUserId(), request.getDisplayName(), request.getFcmToken());
    }

    @DeleteMapping("/me")
    public CompletableFuture<ResponseEntity<Void>> deleteUser(
            @RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        CallerIdentity caller = identityResolver.resolve(authorization);
        return userDirectoryService.deleteUser(caller.getUserId())
                .thenApply(ignored -> ResponseEntity.noContent().<Void>build());
    }

    private static ResponseEntity<User> okOrNotFound(Optional<User> user) {
        return user.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return StringUtils.hasText(preferred) ? preferred : fallback;
    }
}
