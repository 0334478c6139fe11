package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Task dispatch through Kafka (optional)
 *
 * Tasks are published to the chat-tasks topic as JSON and run by
 * {@link com.demo.groupchat.consumer.TaskConsumer} on whichever instance receives them.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class KafkaTaskDispatcher implements TaskDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-tasks:chat-tasks}")
    private String tasksTopic;

    public KafkaTaskDispatcher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                               MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @Override
    public void dispatch(TaskRequest task) {
        String key = partitionKey(task);
        try {
            String payload = objectMapper.writeValueAsString(task);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(tasksTopic, key, payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Task published: operation={}, topic={}, partition={}, offset={}",
                        task.getOperation(), tasksTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish task: operation={}, topic={}", task.getOperation(), tasksTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "KafkaTaskDispatcher");
                }
            });
            metricsService.recordTaskDispatched(task.getOperation());

        } catch (JsonProcessingException e) {
            log.error("Could not serialize task: operation={}", task.getOperation(), e);
            metricsService.recordError("TASK_SERIALIZATION_ERROR", "KafkaTaskDispatcher");
        } catch (RuntimeException e) {
            log.error("Error publishing task: operation={}", task.getOperation(), e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "KafkaTaskDispatcher");
        }
    }

    private static String partitionKey(TaskRequest task) {
        String conversationId = task.stringArgument("conversationId");
        return conversationId != null ? conversationId : task.stringArgument("userId");
    }
}
