package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Envelope for an out-of-band operation. Delivered at most once, with no result
 * returned to whoever dispatched it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    private Operation operation;
    @Builder.Default
    private Map<String, Object> arguments = new HashMap<>();
    private Instant requestedAt;

    public enum Operation {
        SEND_PUSH_NOTIFICATIONS,
        REPAIR_SENDER_SNAPSHOTS
    }

    public static TaskRequest sendPushNotifications(String conversationId, String sender,
                                                    String message, boolean dryRun) {
        Map<String, Object> args = new HashMap<>();
        args.put("conversationId", conversationId);
        args.put("sender", sender);
        args.put("message", message);
        args.put("dryRun", dryRun);
        return TaskRequest.builder()
                .operation(Operation.SEND_PUSH_NOTIFICATIONS)
                .arguments(args)
                .requestedAt(Instant.now())
                .build();
    }

    public static TaskRequest repairSenderSnapshots(String userId) {
        Map<String, Object> args = new HashMap<>();
        args.put("userId", userId);
        return TaskRequest.builder()
                .operation(Operation.REPAIR_SENDER_SNAPSHOTS)
                .arguments(args)
                .requestedAt(Instant.now())
                .build();
    }

    public String stringArgument(String name) {
        Object value = arguments != null ? arguments.get(name) : null;
        return value != null ? value.toString() : null;
    }

    public boolean booleanArgument(String name) {
        Object value = arguments != null ? arguments.get(name) : null;
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
