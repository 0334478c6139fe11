package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one push send.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushResult {

    private boolean success;
    private String messageName;
    private FailureType failureType;
    private String errorMessage;

    public enum FailureType {
        INVALID_TOKEN,
        UNAVAILABLE,
        REJECTED
    }

    public static PushResult sent(String messageName) {
        return PushResult.builder()
                .success(true)
                .messageName(messageName)
                .build();
    }

    public static PushResult failed(FailureType type, String errorMessage) {
        return PushResult.builder()
                .success(false)
                .failureType(type)
                .errorMessage(errorMessage)
                .build();
    }
}
