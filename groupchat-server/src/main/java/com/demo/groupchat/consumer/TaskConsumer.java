package com.demo.groupchat.consumer;

import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.infrastructure.TaskRouter;
import com.demo.groupchat.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Kafka Consumer for out-of-band tasks
 *
 * At-most-once: the offset is committed before the task runs, so a crash mid-task
 * loses the task instead of running it twice.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class TaskConsumer {

    private final ObjectMapper objectMapper;
    private final TaskRouter taskRouter;
    private final MetricsService metricsService;

    public TaskConsumer(ObjectMapper objectMapper, TaskRouter taskRouter, MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.taskRouter = taskRouter;
        this.metricsService = metricsService;
        log.info("TaskConsumer initialized - tasks run from Kafka");
    }

    @KafkaListener(
        topics = "${kafka.topics.chat-tasks:chat-tasks}",
        groupId = "${spring.kafka.consumer.group-id:chat-task-consumer}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeTask(String taskJson, Acknowledgment acknowledgment) {
        acknowledgment.acknowledge();

        TaskRequest task;
        try {
            task = objectMapper.readValue(taskJson, TaskRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping malformed task: {}", e.getOriginalMessage());
            metricsService.recordError("TASK_MALFORMED", "TaskConsumer");
            return;
        }

        log.debug("Task received: operation={}", task.getOperation());
        taskRouter.route(task);
    }
}
