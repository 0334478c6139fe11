package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Push payload for a single recipient. Rendered by the gateway into the provider's
 * wire format (APNs alert plus a data section).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushNotification {

    private String conversationId;
    private User sender;
    private String message;
    private String title;
    @Builder.Default
    private String sound = "default";
    @Builder.Default
    private int badge = 0;
    @Builder.Default
    private String apnsPriority = "10";
}
