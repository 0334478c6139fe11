package com.demo.groupchat.service;

import com.demo.groupchat.domain.RegisterUserRequest;
import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.repository.ChatCollections;
import com.demo.groupchat.store.IndexQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.demo.groupchat.service.ServiceFixture.codeOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserDirectoryServiceTest {

    private static final String PHONE = "+12015550123";

    private final ServiceFixture fixture = new ServiceFixture();
    private final UserDirectoryService users = fixture.users;

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void badEmailIsRejectedAndNothingIsWritten() {
        assertEquals(ErrorCode.INVALID_ARGUMENT,
                codeOf(() -> users.registerWithEmail("u1", "bad-email", "Name", null)));

        assertTrue(users.getUser("u1").join().isEmpty());
    }

    @Test
    void missingRequiredFieldsAreReportedTogether() {
        ChatServiceException e = ServiceFixture.failureOf(() -> users.registerWithEmail("", "a@example.com", " ", null));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
        assertTrue(e.getMessage().contains("userId"));
        assertTrue(e.getMessage().contains("displayName"));
    }

    @Test
    void registerWithEmailStoresNormalizedEmail() {
        User user = users.registerWithEmail("u1", "Ann@Example.COM", "Ann", "token-1").join();

        assertEquals("ann@example.com", user.getEmail());
        assertEquals(user, users.lookupByEmail("ANN@example.com").join().orElseThrow());
    }

    @Test
    void duplicateEmailFailsWithAlreadyExists() {
        fixture.register("u1", "ann@example.com", null);

        assertEquals(ErrorCode.ALREADY_EXISTS,
                codeOf(() -> users.registerWithEmail("u2", "ann@example.com", "Other", null)));
    }

    @Test
    void duplicateUserIdFailsWithAlreadyExists() {
        fixture.register("u1", "ann@example.com", null);

        assertEquals(ErrorCode.ALREADY_EXISTS,
                codeOf(() -> users.registerWithEmail("u1", "someone@example.com", "Other", null)));
    }

    @Test
    void registerWithPhoneNormalizesToE164() {
        User user = users.registerWithPhone("u1", "(201) 555-0123", "Ann", null).join();

        assertEquals(PHONE, user.getPhoneNumber());
        assertEquals("u1", users.lookupByPhone("201-555-0123").join().orElseThrow().getUserId());
    }

    @Test
    void invalidPhoneIsRejected() {
        assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> users.registerWithPhone("u1", "12", "Ann", null)));
        assertTrue(users.lookupByPhone("not a number").join().isEmpty());
    }

    @Test
    void concurrentPhoneRegistrationStoresExactlyOneUser() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<CompletableFuture<User>> first = callers.submit(() -> {
                start.await();
                return users.registerWithPhone("u1", PHONE, "Ann", null);
            });
            Future<CompletableFuture<User>> second = callers.submit(() -> {
                start.await();
                return users.registerWithPhone("u2", PHONE, "Bob", null);
            });
            start.countDown();

            List<CompletableFuture<User>> attempts = List.of(first.get(), second.get());
            CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();

            long succeeded = attempts.stream().filter(f -> !f.isCompletedExceptionally()).count();
            long duplicates = attempts.stream()
                    .filter(CompletableFuture::isCompletedExceptionally)
                    .filter(f -> codeOf(() -> f) == ErrorCode.ALREADY_EXISTS)
                    .count();
            assertEquals(1, succeeded);
            assertEquals(1, duplicates);
            assertEquals(1, fixture.store.query(ChatCollections.USERS,
                    IndexQuery.on(ChatCollections.BY_PHONE, PHONE)).size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void registerUsersRoutesByIdentityField() {
        List<User> registered = users.registerUsers(List.of(
                RegisterUserRequest.builder().userId("u1").phoneNumber(PHONE).displayName("Ann").build(),
                RegisterUserRequest.builder().userId("u2").email("bob@example.com").displayName("Bob").build()))
                .join();

        assertEquals(PHONE, registered.get(0).getPhoneNumber());
        assertEquals("bob@example.com", registered.get(1).getEmail());
    }

    @Test
    void validateUserIdsIsAllOrNothing() {
        fixture.register("u1", "ann@example.com", null);
        fixture.register("u2", "bob@example.com", null);

        assertTrue(users.validateUserIds(List.of("u1", "u2")).join());
        assertFalse(users.validateUserIds(List.of("u1", "ghost")).join());
    }

    @Test
    void updateUserPatchesSuppliedFieldsAndSchedulesRepair() {
        fixture.register("u1", "ann@example.com", "old-token");

        User updated = users.updateUser("u1", "New", null).join();

        assertEquals("New", updated.getDisplayName());
        assertEquals("old-token", updated.getFcmToken());
        assertEquals(1, fixture.dispatcher.tasks.size());
        TaskRequest task = fixture.dispatcher.tasks.get(0);
        assertEquals(TaskRequest.Operation.REPAIR_SENDER_SNAPSHOTS, task.getOperation());
        assertEquals("u1", task.stringArgument("userId"));
    }

    @Test
    void updateUserRequiresAField() {
        assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> users.updateUser("u1", null, " ")));
    }

    @Test
    void updateOfUnknownUserFailsWithNotFound() {
        assertEquals(ErrorCode.NOT_FOUND, codeOf(() -> users.updateUser("ghost", "New", null)));
        assertTrue(fixture.dispatcher.tasks.isEmpty());
    }

    @Test
    void deleteRemovesOnlyTheUserRecord() {
        fixture.register("u1", "ann@example.com", null);

        users.deleteUser("u1").join();

        assertTrue(users.getUser("u1").join().isEmpty());
        assertTrue(users.lookupByEmail("ann@example.com").join().isEmpty());
    }
}
