package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Read model returned by conversation retrieval: current members plus messages in
 * timestamp order. Never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {

    private String conversationId;
    private List<User> users;
    private List<Message> messages;
}
