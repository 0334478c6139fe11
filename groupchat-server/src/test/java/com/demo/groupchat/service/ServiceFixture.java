package com.demo.groupchat.service;

import com.demo.groupchat.config.JacksonConfig;
import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.infrastructure.ConversationLock;
import com.demo.groupchat.infrastructure.PushGateway;
import com.demo.groupchat.infrastructure.TaskDispatcher;
import com.demo.groupchat.repository.MembershipRepository;
import com.demo.groupchat.repository.MessageRepository;
import com.demo.groupchat.repository.UserRepository;
import com.demo.groupchat.store.InMemoryDocumentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Wires the services over an in-memory store and a real I/O pool. Dispatched tasks
 * are recorded instead of run.
 */
class ServiceFixture implements AutoCloseable {

    final InMemoryDocumentStore store = new InMemoryDocumentStore(JacksonConfig.createObjectMapper());
    final ExecutorService ioExecutor = Executors.newFixedThreadPool(8);
    final MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
    final RecordingTaskDispatcher dispatcher = new RecordingTaskDispatcher();

    final UserRepository userRepository = new UserRepository(store, ioExecutor);
    final MembershipRepository membershipRepository = new MembershipRepository(store, ioExecutor);
    final MessageRepository messageRepository = new MessageRepository(store, ioExecutor);

    final UserDirectoryService users =
            new UserDirectoryService(userRepository, new UserValidator("US"), dispatcher, metricsService);
    final ConversationService conversations =
            new ConversationService(membershipRepository, users, ConversationLock.NONE, metricsService);
    final MessageService messages = new MessageService(messageRepository, users, conversations, dispatcher,
            new MessageClock(), metricsService, 5);

    NotificationFanoutService notifications(PushGateway gateway, NotificationFanoutService.MissingTokenPolicy policy) {
        return new NotificationFanoutService(conversations, gateway, metricsService, policy, "Received message from user");
    }

    SenderSnapshotRepairService repair() {
        return new SenderSnapshotRepairService(users, messages, messageRepository, metricsService);
    }

    User register(String userId, String email, String fcmToken) {
        return users.registerWithEmail(userId, email, "User " + userId, fcmToken).join();
    }

    String initiate(String initiator, String... others) {
        return conversations.initiate(initiator, List.of(others)).join();
    }

    /**
     * The domain failure of an operation, whether thrown before returning or carried by the future.
     */
    static ChatServiceException failureOf(Supplier<? extends CompletableFuture<?>> operation) {
        RuntimeException thrown = assertThrows(RuntimeException.class, () -> operation.get().join());
        Throwable cause = thrown instanceof CompletionException ? ChatServiceException.unwrap(thrown) : thrown;
        return assertInstanceOf(ChatServiceException.class, cause);
    }

    static ErrorCode codeOf(Supplier<? extends CompletableFuture<?>> operation) {
        return failureOf(operation).getCode();
    }

    @Override
    public void close() throws InterruptedException {
        ioExecutor.shutdownNow();
        ioExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    static class RecordingTaskDispatcher implements TaskDispatcher {

        final List<TaskRequest> tasks = new CopyOnWriteArrayList<>();

        @Override
        public void dispatch(TaskRequest task) {
            tasks.add(task);
        }
    }
}
