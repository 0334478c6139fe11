package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.exception.ChatServiceException;
import com.demo.groupchat.service.MetricsService;
import com.demo.groupchat.service.NotificationFanoutService;
import com.demo.groupchat.service.SenderSnapshotRepairService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a dispatched task against the service that owns its operation.
 * Failures are logged and counted; nothing is retried.
 */
@Component
@Slf4j
public class TaskRouter {

    private final NotificationFanoutService notificationFanoutService;
    private final SenderSnapshotRepairService senderSnapshotRepairService;
    private final MetricsService metricsService;

    public TaskRouter(NotificationFanoutService notificationFanoutService,
                      SenderSnapshotRepairService senderSnapshotRepairService,
                      MetricsService metricsService) {
        this.notificationFanoutService = notificationFanoutService;
        this.senderSnapshotRepairService = senderSnapshotRepairService;
        this.metricsService = metricsService;
    }

    @EventListener
    public void onTask(TaskRequest task) {
        route(task);
    }

    public CompletableFuture<?> route(TaskRequest task) {
        TaskRequest.Operation operation = task.getOperation();
        CompletableFuture<?> run = Futures.attempt(() -> start(task));

        return run.whenComplete((result, error) -> {
            if (error != null) {
                log.error("Task failed: operation={}", operation, ChatServiceException.unwrap(error));
                metricsService.recordTaskFailed(operation);
            } else {
                log.info("Task completed: operation={}, result={}", operation, result);
            }
        });
    }

    private CompletableFuture<Object> start(TaskRequest task) {
        if (task.getOperation() == null) {
            throw ChatServiceException.invalidArgument("Task has no operation");
        }
        return switch (task.getOperation()) {
            case SEND_PUSH_NOTIFICATIONS -> notificationFanoutService.sendPushNotifications(
                    task.stringArgument("conversationId"),
                    task.stringArgument("sender"),
                    task.stringArgument("message"),
                    task.booleanArgument("dryRun")).thenApply(summary -> summary);
            case REPAIR_SENDER_SNAPSHOTS -> senderSnapshotRepairService.repairSenderSnapshots(
                    task.stringArgument("userId")).thenApply(summary -> summary);
        };
    }
}
