package com.demo.groupchat.repository;

import com.demo.groupchat.domain.Membership;
import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.store.DocumentCollection;

/**
 * The three logical collections and their access paths.
 */
public final class ChatCollections {

    public static final String BY_PHONE = "phoneNumber";
    public static final String BY_EMAIL = "email";
    public static final String BY_USER = "userId";
    public static final String BY_CONVERSATION = "conversationId";

    public static final DocumentCollection<User> USERS =
            DocumentCollection.builder("users", User.class, User::getUserId)
                    .uniqueIndex(BY_PHONE, User::getPhoneNumber)
                    .uniqueIndex(BY_EMAIL, User::getEmail)
                    .build();

    // both halves of the composite key are query paths
    public static final DocumentCollection<Membership> MEMBERSHIPS =
            DocumentCollection.builder("memberships", Membership.class,
                            (Membership m) -> DocumentCollection.key(m.getUserId(), m.getConversationId()))
                    .index(BY_USER, Membership::getUserId, Membership::getConversationId)
                    .index(BY_CONVERSATION, Membership::getConversationId, Membership::getUserId)
                    .build();

    public static final DocumentCollection<Message> MESSAGES =
            DocumentCollection.builder("messages", Message.class,
                            (Message m) -> DocumentCollection.key(m.getConversationId(), m.getTimestamp()))
                    .index(BY_CONVERSATION, Message::getConversationId, Message::getTimestamp)
                    .build();

    private ChatCollections() {
    }
}
