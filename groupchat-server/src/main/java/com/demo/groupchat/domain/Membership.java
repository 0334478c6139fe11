package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * A user's participation in a conversation. A conversation has no row of its own;
 * it is the set of memberships sharing a conversationId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Membership implements Serializable {
    private static final long serialVersionUID = 1L;

    private String userId;
    private String conversationId;
}
