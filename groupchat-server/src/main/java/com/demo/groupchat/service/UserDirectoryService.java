package com.demo.groupchat.service;

import com.demo.groupchat.domain.RegisterUserRequest;
import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.infrastructure.Futures;
import com.demo.groupchat.infrastructure.TaskDispatcher;
import com.demo.groupchat.repository.UserRepository;
import com.demo.groupchat.store.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * User Directory
 *
 * Registration by email or phone, lookups by either alternate key, and profile updates.
 * Input validation fails synchronously; everything after the first storage call fails
 * through the returned future.
 *
 * Phone and email are unique indexes of the users collection, so the insert is the
 * authoritative duplicate check; the lookup before it only gives a clearer error.
 */
@Service
@Slf4j
public class UserDirectoryService {

    private final UserRepository userRepository;
    private final UserValidator userValidator;
    private final TaskDispatcher taskDispatcher;
    private final MetricsService metricsService;

    public UserDirectoryService(UserRepository userRepository, UserValidator userValidator,
                                TaskDispatcher taskDispatcher, MetricsService metricsService) {
        this.userRepository = userRepository;
        this.userValidator = userValidator;
        this.taskDispatcher = taskDispatcher;
        this.metricsService = metricsService;
    }

    public CompletableFuture<User> registerWithEmail(String userId, String email, String displayName, String fcmToken) {
        userValidator.validateEmailRegistration(userId, email, displayName).orThrow();

        String normalizedEmail = userValidator.normalizeEmail(email);
        User user = User.builder()
                .userId(userId)
                .email(normalizedEmail)
                .displayName(displayName)
                .fcmToken(fcmToken)
                .build();

        return userRepository.findFirstByEmail(normalizedEmail).thenCompose(existing -> {
            if (existing.isPresent()) {
                throw ChatServiceException.alreadyExists("User with email " + normalizedEmail + " already exists");
            }
            return insert(user, "email");
        });
    }

    public CompletableFuture<User> registerWithPhone(String userId, String phoneNumber, String displayName, String fcmToken) {
        userValidator.validatePhoneRegistration(userId, phoneNumber, displayName).orThrow();

        String normalizedPhone = userValidator.normalizePhoneNumber(phoneNumber).orElseThrow();
        User user = User.builder()
                .userId(userId)
                .phoneNumber(normalizedPhone)
                .displayName(displayName)
                .fcmToken(fcmToken)
                .build();

        return userRepository.findFirstByPhoneNumber(normalizedPhone).thenCompose(existing -> {
            if (existing.isPresent()) {
                throw ChatServiceException.alreadyExists("User with phone number already exists");
            }
            return insert(user, "phone");
        });
    }

    /**
     * Register several users at once; entries with a phone number register by phone,
     * the rest by email. Fails with the first failure; users registered before it stay.
     */
    public CompletableFuture<List<User>> registerUsers(List<RegisterUserRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw ChatServiceException.invalidArgument("registerUsers requires a non-empty list");
        }
        List<CompletableFuture<User>> registrations = requests.stream()
                .map(request -> Futures.attempt(() -> StringUtils.hasText(request.getPhoneNumber())
                        ? registerWithPhone(request.getUserId(), request.getPhoneNumber(),
                                request.getDisplayName(), request.getFcmToken())
                        : registerWithEmail(request.getUserId(), request.getEmail(),
                                request.getDisplayName(), request.getFcmToken())))
                .collect(Collectors.toList());
        return Futures.allOf(registrations);
    }

    /** Find a user by phone number; empty when unknown or unparseable. */
    public CompletableFuture<Optional<User>> lookupByPhone(String phoneNumber) {
        Optional<String> normalized = userValidator.normalizePhoneNumber(phoneNumber);
        if (normalized.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return userRepository.findFirstByPhoneNumber(normalized.get());
    }

    /** Find a user by email; empty when unknown. */
    public CompletableFuture<Optional<User>> lookupByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return userRepository.findFirstByEmail(userValidator.normalizeEmail(email));
    }

    public CompletableFuture<Optional<User>> getUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return userRepository.findById(userId);
    }

    /**
     * True only if every id resolves to an existing user.
     */
    public CompletableFuture<Boolean> validateUserIds(List<String> userIds) {
        if (userIds == null) {
            throw ChatServiceException.invalidArgument("validateUserIds requires a list");
        }
        List<CompletableFuture<Optional<User>>> lookups = userIds.stream()
                .map(this::getUser)
                .collect(Collectors.toList());
        return Futures.allOf(lookups).thenApply(users -> users.stream().allMatch(Optional::isPresent));
    }

    /**
     * Patch displayName and/or fcmToken. Blank values count as not supplied.
     * Sender snapshot repair is scheduled once the update commits and is never awaited.
     */
    public CompletableFuture<User> updateUser(String userId, String displayName, String fcmToken) {
        if (!StringUtils.hasText(userId)) {
            throw ChatServiceException.invalidArgument("updateUser requires userId");
        }
        boolean hasDisplayName = StringUtils.hasText(displayName);
        boolean hasFcmToken = StringUtils.hasText(fcmToken);
        if (!hasDisplayName && !hasFcmToken) {
            throw ChatServiceException.invalidArgument("Must specify either fcmToken or displayName");
        }

        return userRepository.updateExisting(userId, user -> {
            if (hasDisplayName) {
                user.setDisplayName(displayName);
            }
            if (hasFcmToken) {
                user.setFcmToken(fcmToken);
            }
            return user;
        }).thenApply(result -> {
            if (!result.isSuccess()) {
                throw ChatServiceException.notFound("User " + userId + " does not exist");
            }
            log.info("User updated: userId={}, displayName={}, fcmToken={}", userId, hasDisplayName, hasFcmToken);
            scheduleRepair(userId);
            return result.getDocument();
        });
    }

    /**
     * Delete the user record only; memberships and messages keep their references.
     */
    public CompletableFuture<Void> deleteUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ChatServiceException.invalidArgument("deleteUser requires userId");
        }
        return userRepository.deleteById(userId)
                .thenRun(() -> log.info("User deleted: userId={}", userId));
    }

    private CompletableFuture<User> insert(User user, String identityType) {
        return userRepository.insert(user).thenApply((WriteResult<User> result) -> {
            if (!result.isSuccess()) {
                throw ChatServiceException.alreadyExists("User already exists");
            }
            metricsService.recordUserRegistered(identityType);
            return result.getDocument();
        });
    }

    private void scheduleRepair(String userId) {
        try {
            taskDispatcher.dispatch(TaskRequest.repairSenderSnapshots(userId));
        } catch (RuntimeException e) {
            log.error("Could not schedule sender snapshot repair: userId={}", userId, e);
            metricsService.recordError("REPAIR_DISPATCH_ERROR", "UserDirectoryService");
        }
    }
}
