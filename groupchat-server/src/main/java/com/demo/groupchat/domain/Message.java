package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Message Domain Model
 *
 * Keyed by (conversationId, timestamp). The sender is a copy of the user record taken
 * at post time and is only ever rewritten by sender snapshot repair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {
    private static final long serialVersionUID = 1L;

    private String conversationId;
    private String timestamp;     // ISO-8601 UTC, sort key
    private String message;
    private User sender;

    public String senderId() {
        return sender != null ? sender.getUserId() : null;
    }
}
