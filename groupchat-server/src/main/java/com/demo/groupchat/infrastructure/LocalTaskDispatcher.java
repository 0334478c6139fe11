package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process dispatch: the task is published as an application event on the task pool,
 * where {@link TaskRouter} picks it up.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LocalTaskDispatcher implements TaskDispatcher {

    private final ApplicationEventPublisher eventPublisher;
    private final Executor taskExecutor;
    private final MetricsService metricsService;

    public LocalTaskDispatcher(ApplicationEventPublisher eventPublisher,
                               @Qualifier("taskExecutor") Executor taskExecutor,
                               MetricsService metricsService) {
        this.eventPublisher = eventPublisher;
        this.taskExecutor = taskExecutor;
        this.metricsService = metricsService;
    }

    @Override
    public void dispatch(TaskRequest task) {
        try {
            taskExecutor.execute(() -> eventPublisher.publishEvent(task));
            metricsService.recordTaskDispatched(task.getOperation());
            log.debug("Task dispatched locally: operation={}", task.getOperation());
        } catch (RejectedExecutionException e) {
            log.error("Task dropped, executor saturated: operation={}", task.getOperation(), e);
            metricsService.recordError("TASK_REJECTED", "LocalTaskDispatcher");
        }
    }
}
