package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.PushNotification;
import com.demo.groupchat.domain.PushResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Firebase Cloud Messaging HTTP v1 gateway.
 *
 * Messages target a single device token and carry an APNs alert plus a data section
 * with the conversation id, the sender snapshot and the message text.
 */
@Slf4j
public class FcmPushGateway implements PushGateway {

    private final RestTemplate restTemplate;
    private final String sendUrl;
    private final String accessToken;
    private final Executor ioExecutor;

    public FcmPushGateway(RestTemplate restTemplate, String baseUrl, String projectId,
                          String accessToken, Executor ioExecutor) {
        this.restTemplate = restTemplate;
        this.sendUrl = baseUrl + "/v1/projects/" + projectId + "/messages:send";
        this.accessToken = accessToken;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public PushSession openSession() {
        log.debug("Push session opened: url={}", sendUrl);
        return new FcmSession();
    }

    private class FcmSession implements PushSession {

        private final AtomicBoolean closed = new AtomicBoolean();
        private final AtomicInteger requests = new AtomicInteger();

        @Override
        public CompletableFuture<PushResult> send(String deviceToken, PushNotification notification, boolean dryRun) {
            if (closed.get()) {
                return CompletableFuture.failedFuture(new IllegalStateException("Push session already closed"));
            }
            requests.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> post(deviceToken, notification, dryRun), ioExecutor);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                log.debug("Push session closed: requests={}", requests.get());
            }
        }
    }

    PushResult post(String deviceToken, PushNotification notification, boolean dryRun) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(accessToken)) {
            headers.setBearerAuth(accessToken);
        }
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody(deviceToken, notification, dryRun), headers);

        try {
            @SuppressWarnings("rawtypes")
            ResponseEntity<Map> response = restTemplate.postForEntity(sendUrl, request, Map.class);
            Object name = response.getBody() != null ? response.getBody().get("name") : null;
            log.debug("Push accepted: conversationId={}, name={}, dryRun={}",
                    notification.getConversationId(), name, dryRun);
            return PushResult.sent(name != null ? name.toString() : null);

        } catch (HttpClientErrorException e) {
            String body = e.getResponseBodyAsString();
            PushResult.FailureType type = isInvalidToken(e.getStatusCode().value(), body)
                    ? PushResult.FailureType.INVALID_TOKEN
                    : PushResult.FailureType.REJECTED;
            log.warn("Push rejected: status={}, type={}", e.getStatusCode(), type);
            return PushResult.failed(type, e.getStatusCode() + " " + body);

        } catch (HttpServerErrorException e) {
            log.warn("Push provider error: status={}", e.getStatusCode());
            return PushResult.failed(PushResult.FailureType.UNAVAILABLE, e.getStatusCode().toString());

        } catch (ResourceAccessException e) {
            log.warn("Push provider unreachable: {}", e.getMessage());
            return PushResult.failed(PushResult.FailureType.UNAVAILABLE, e.getMessage());
        }
    }

    private static boolean isInvalidToken(int status, String body) {
        return status == HttpStatus.NOT_FOUND.value()
                || (body != null && (body.contains("UNREGISTERED") || body.contains("registration-token")));
    }

    static Map<String, Object> requestBody(String deviceToken, PushNotification notification, boolean dryRun) {
        Map<String, Object> alert = new HashMap<>();
        alert.put("title", notification.getTitle());
        alert.put("body", notification.getMessage());

        Map<String, Object> aps = new HashMap<>();
        aps.put("alert", alert);
        aps.put("sound", notification.getSound());
        aps.put("badge", notification.getBadge());

        Map<String, Object> data = new HashMap<>();
        data.put("conversationId", notification.getConversationId());
        data.put("sender", notification.getSender());
        data.put("message", notification.getMessage());

        Map<String, Object> payload = new HashMap<>();
        payload.put("aps", aps);
        payload.put("data", data);

        Map<String, Object> apns = new HashMap<>();
        apns.put("headers", Map.of("apns-priority", notification.getApnsPriority()));
        apns.put("payload", payload);

        Map<String, Object> message = new HashMap<>();
        message.put("token", deviceToken);
        message.put("apns", apns);

        Map<String, Object> body = new HashMap<>();
        body.put("validate_only", dryRun);
        body.put("message", message);
        return body;
    }
}
