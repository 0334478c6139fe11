package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts for one notification fan-out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSummary {

    private String conversationId;
    private int recipients;
    private int sent;
    private int failed;
    private int missingToken;
}
