package com.demo.groupchat.service;

import com.demo.groupchat.domain.Conversation;
import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.TaskRequest;
import com.demo.groupchat.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static com.demo.groupchat.service.ServiceFixture.codeOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private final ServiceFixture fixture = new ServiceFixture();
    private final MessageService messages = fixture.messages;

    private String conversationId;

    @BeforeEach
    void setUp() {
        fixture.register("a", "a@example.com", "token-a");
        fixture.register("b", "b@example.com", "token-b");
        fixture.register("c", "c@example.com", "token-c");
        conversationId = fixture.initiate("a", "b", "c");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void groupScenario() {
        assertEquals(conversationId, fixture.initiate("b", "a", "c"));

        Message hi = messages.post("a", conversationId, "hi", false).join();
        assertEquals("a", hi.getSender().getUserId());
        assertEquals("hi", hi.getMessage());

        fixture.conversations.leave("c", conversationId).join();

        assertEquals(ErrorCode.NOT_A_MEMBER, codeOf(() -> messages.post("c", conversationId, "bye", false)));
    }

    @Test
    void postEmbedsSenderSnapshot() {
        Message posted = messages.post("b", conversationId, "hello", false).join();

        assertEquals("User b", posted.getSender().getDisplayName());
        assertEquals("token-b", posted.getSender().getFcmToken());
    }

    @Test
    void unknownSenderFailsWithInvalidSender() {
        assertEquals(ErrorCode.INVALID_SENDER, codeOf(() -> messages.post("ghost", conversationId, "hi", false)));
    }

    @Test
    void notifyDispatchesPushTaskOnlyWhenAsked() {
        messages.post("a", conversationId, "quiet", false).join();
        assertTrue(fixture.dispatcher.tasks.isEmpty());

        messages.post("a", conversationId, "loud", true).join();

        assertEquals(1, fixture.dispatcher.tasks.size());
        TaskRequest task = fixture.dispatcher.tasks.get(0);
        assertEquals(TaskRequest.Operation.SEND_PUSH_NOTIFICATIONS, task.getOperation());
        assertEquals(conversationId, task.stringArgument("conversationId"));
        assertEquals("a", task.stringArgument("sender"));
        assertEquals("loud", task.stringArgument("message"));
    }

    @Test
    void rapidPostsGetDistinctOrderedTimestamps() {
        for (int i = 0; i < 20; i++) {
            messages.post("a", conversationId, "m" + i, false).join();
        }

        List<Message> stored = messages.getConversation(conversationId, "b", null).join().getMessages();

        assertEquals(20, stored.size());
        assertEquals("m0", stored.get(0).getMessage());
        assertEquals("m19", stored.get(19).getMessage());
    }

    @Test
    void getConversationReturnsMembersAndMessagesSince() {
        Message first = messages.post("a", conversationId, "one", false).join();
        messages.post("b", conversationId, "two", false).join();

        Conversation all = messages.getConversation(conversationId, "c", null).join();
        Conversation since = messages.getConversation(conversationId, "c", first.getTimestamp()).join();

        assertEquals(3, all.getUsers().size());
        assertEquals(2, all.getMessages().size());
        assertEquals(List.of("two"), since.getMessages().stream().map(Message::getMessage).collect(Collectors.toList()));
    }

    @Test
    void nonMemberCannotReadConversation() {
        fixture.register("d", "d@example.com", null);

        assertEquals(ErrorCode.NOT_A_MEMBER, codeOf(() -> messages.getConversation(conversationId, "d", null)));
    }

    @Test
    void historyCoversEveryConversationOfTheUser() {
        String pair = fixture.initiate("a", "b");
        messages.post("a", conversationId, "group", false).join();
        messages.post("b", pair, "pair", false).join();

        List<Conversation> history = messages.history("a").join();

        assertEquals(2, history.size());
        assertEquals(1, messages.history("c").join().size());
    }

    @Test
    void collidingTimestampMovesToNextFreeTick() {
        seed("2030-01-01T00:00:00.000Z");
        seed("2030-01-01T00:00:00.001Z");

        Message posted = messagesAtFixedClock(5).post("a", conversationId, "late", false).join();

        assertEquals("2030-01-01T00:00:00.002Z", posted.getTimestamp());
        assertEquals(3, messages.getConversation(conversationId, "b", null).join().getMessages().size());
    }

    @Test
    void exhaustedWriteAttemptsFailWithUpstream() {
        seed("2030-01-01T00:00:00.000Z");

        assertEquals(ErrorCode.UPSTREAM,
                codeOf(() -> messagesAtFixedClock(1).post("a", conversationId, "late", false)));
        assertEquals(1, messages.getConversation(conversationId, "b", null).join().getMessages().size());
    }

    @Test
    void postLatencyIsTimedByOutcome() {
        messages.post("a", conversationId, "timed", false).join();
        assertEquals(ErrorCode.INVALID_SENDER, codeOf(() -> messages.post("ghost", conversationId, "timed", false)));

        assertEquals(1, fixture.metricsService.getTimerCount("chat.messages.post.latency", "outcome", "success"));
        assertEquals(1, fixture.metricsService.getTimerCount("chat.messages.post.latency", "outcome", "failure"));
    }

    private MessageService messagesAtFixedClock(int maxWriteAttempts) {
        Clock fixed = Clock.fixed(Instant.parse("2030-01-01T00:00:00Z"), ZoneOffset.UTC);
        return new MessageService(fixture.messageRepository, fixture.users, fixture.conversations,
                fixture.dispatcher, new MessageClock(fixed), fixture.metricsService, maxWriteAttempts);
    }

    private void seed(String timestamp) {
        Message existing = Message.builder()
                .conversationId(conversationId)
                .timestamp(timestamp)
                .message("earlier")
                .sender(fixture.users.getUser("b").join().orElseThrow())
                .build();
        assertTrue(fixture.messageRepository.insert(existing).join().isSuccess());
    }
}
