package com.demo.groupchat.config;

import com.demo.groupchat.infrastructure.FcmPushGateway;
import com.demo.groupchat.infrastructure.LoggingPushGateway;
import com.demo.groupchat.infrastructure.PushGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;

/**
 * Push provider selection. {@code chat.push.enabled=true} sends through FCM.
 */
@Configuration
@Slf4j
public class PushConfig {

    @Bean
    @ConditionalOnProperty(name = "chat.push.enabled", havingValue = "true")
    public PushGateway fcmPushGateway(
            @Qualifier("pushRestTemplate") RestTemplate restTemplate,
            @Value("${chat.push.fcm.base-url:https://fcm.googleapis.com}") String baseUrl,
            @Value("${chat.push.fcm.project-id}") String projectId,
            // Short-lived OAuth token; it must be refreshed outside this service.
            @Value("${chat.push.fcm.access-token:}") String accessToken,
            @Qualifier("ioExecutor") Executor ioExecutor) {
        log.info("Push notifications via FCM: project={}", projectId);
        return new FcmPushGateway(restTemplate, baseUrl, projectId, accessToken, ioExecutor);
    }

    @Bean
    @ConditionalOnProperty(name = "chat.push.enabled", havingValue = "false", matchIfMissing = true)
    public PushGateway loggingPushGateway() {
        log.info("Push notifications disabled, sends are only logged");
        return new LoggingPushGateway();
    }
}
