package com.demo.groupchat.service;

import com.demo.groupchat.domain.NotificationSummary;
import com.demo.groupchat.domain.PushResult;
import com.demo.groupchat.domain.RepairSummary;
import com.demo.groupchat.domain.TaskRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Metrics Service
 *
 * Domain counters on the Micrometer registry, mirrored to debug logs:
 * - registrations, conversations created/reused, messages posted
 * - push sends, failures and members skipped for lack of a token
 * - sender snapshot repairs
 * - task dispatch and task failures
 * - latency of message posts and push fan-outs
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        log.info("✅ MetricsService initialized with {}", registry.getClass().getSimpleName());
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name, String... tags) {
        incrementCounter(name, 1, tags);
    }

    public void incrementCounter(String name, double amount, String... tags) {
        if (amount <= 0) {
            return;
        }
        registry.counter(name, tags).increment(amount);
        log.debug("[METRIC] Counter: {} {} += {}", name, Arrays.toString(tags), amount);
    }

    // ===== Timer Metrics =====

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String name, String... tags) {
        long nanos = sample.stop(registry.timer(name, tags));
        log.debug("[METRIC] Timer: {} = {}ms", name, nanos / 1_000_000);
    }

    // ===== Business Metrics =====

    public void recordUserRegistered(String identityType) {
        incrementCounter("chat.users.registered", "identity", identityType);
        log.info("👤 User registered: identity={}", identityType);
    }

    public void recordConversationInitiated(boolean reused) {
        incrementCounter("chat.conversations.initiated", "outcome", reused ? "reused" : "created");
    }

    public void recordMessagePosted(boolean notify) {
        incrementCounter("chat.messages.posted", "notify", String.valueOf(notify));
    }

    public void recordPushResult(PushResult result) {
        if (result.isSuccess()) {
            incrementCounter("chat.push.sent");
        } else {
            incrementCounter("chat.push.failed", "reason", String.valueOf(result.getFailureType()));
        }
    }

    public void recordNotificationFanOut(NotificationSummary summary) {
        incrementCounter("chat.push.missing_token", summary.getMissingToken());
        log.info("📤 Notification fan-out: conversationId={}, recipients={}, sent={}, failed={}, missingToken={}",
                summary.getConversationId(), summary.getRecipients(), summary.getSent(),
                summary.getFailed(), summary.getMissingToken());
    }

    public void recordSnapshotRepair(RepairSummary summary) {
        incrementCounter("chat.repair.updated", summary.getUpdated());
        incrementCounter("chat.repair.skipped", summary.getSkipped());
        log.info("🔄 Sender snapshot repair: userId={}, examined={}, updated={}, skipped={}",
                summary.getUserId(), summary.getExamined(), summary.getUpdated(), summary.getSkipped());
    }

    public void recordTaskDispatched(TaskRequest.Operation operation) {
        incrementCounter("chat.tasks.dispatched", "operation", operation.name());
    }

    public void recordTaskFailed(TaskRequest.Operation operation) {
        incrementCounter("chat.tasks.failed", "operation", String.valueOf(operation));
    }

    public void recordError(String errorType, String component) {
        incrementCounter("chat.errors", "type", errorType, "component", component);
        log.error("⚠️ Error: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    /**
     * Get current counter value (for debugging and tests)
     */
    public double getCounterValue(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0;
    }

    public long getTimerCount(String name, String... tags) {
        Timer timer = registry.find(name).tags(tags).timer();
        return timer != null ? timer.count() : 0;
    }
}
