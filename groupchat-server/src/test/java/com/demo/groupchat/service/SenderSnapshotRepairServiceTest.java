package com.demo.groupchat.service;

import com.demo.groupchat.domain.Message;
import com.demo.groupchat.domain.RepairSummary;
import com.demo.groupchat.domain.User;
import com.demo.groupchat.exception.ErrorCode;
import com.demo.groupchat.repository.ChatCollections;
import com.demo.groupchat.store.DocumentCollection;
import com.demo.groupchat.store.WriteCondition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demo.groupchat.service.ServiceFixture.codeOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class SenderSnapshotRepairServiceTest {

    private final ServiceFixture fixture = new ServiceFixture();
    private final SenderSnapshotRepairService repair = fixture.repair();

    private String conversationId;

    @BeforeEach
    void setUp() {
        fixture.register("a", "a@example.com", "token-a");
        fixture.register("b", "b@example.com", "token-b");
        conversationId = fixture.initiate("a", "b");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        fixture.close();
    }

    @Test
    void refreshesOnlyTheUpdatedUsersMessages() {
        fixture.messages.post("a", conversationId, "from a", false).join();
        fixture.messages.post("b", conversationId, "from b", false).join();
        fixture.messages.post("a", conversationId, "again from a", false).join();
        fixture.users.updateUser("a", "Alice", "token-a2").join();

        RepairSummary summary = repair.repairSenderSnapshots("a").join();

        assertEquals(3, summary.getExamined());
        assertEquals(2, summary.getUpdated());
        assertEquals(0, summary.getSkipped());
        List<Message> stored = fixture.messages.getConversation(conversationId, "b", null).join().getMessages();
        for (Message message : stored) {
            if ("a".equals(message.senderId())) {
                assertEquals("Alice", message.getSender().getDisplayName());
                assertEquals("token-a2", message.getSender().getFcmToken());
            } else {
                assertEquals("User b", message.getSender().getDisplayName());
            }
        }
    }

    @Test
    void userWithoutHistoryRepairsNothing() {
        fixture.users.updateUser("b", "New", null).join();

        RepairSummary summary = repair.repairSenderSnapshots("b").join();

        assertEquals(0, summary.getExamined());
        assertEquals(0, summary.getUpdated());
    }

    @Test
    void messageWhoseSenderChangedMeanwhileIsSkipped() {
        Message posted = fixture.messages.post("a", conversationId, "hi", false).join();
        String key = DocumentCollection.key(posted.getConversationId(), posted.getTimestamp());
        fixture.store.update(ChatCollections.MESSAGES, key,
                m -> m.toBuilder().sender(User.builder().userId("b").build()).build(), WriteCondition.none());

        RepairSummary summary = repair.repairSenderSnapshots("a").join();

        // the read saw "b" as sender, so nothing matched
        assertEquals(0, summary.getUpdated());
    }

    @Test
    void replaceSenderRefusesWhenStoredSenderDiffers() {
        Message posted = fixture.messages.post("a", conversationId, "hi", false).join();
        String key = DocumentCollection.key(posted.getConversationId(), posted.getTimestamp());
        fixture.store.update(ChatCollections.MESSAGES, key,
                m -> m.toBuilder().sender(User.builder().userId("b").build()).build(), WriteCondition.none());

        boolean written = fixture.messageRepository
                .replaceSender(posted, User.builder().userId("a").displayName("Alice").build(), "a")
                .join().isSuccess();

        assertFalse(written);
    }

    @Test
    void deletedUserIsANoOp() {
        fixture.users.deleteUser("a").join();

        assertEquals(RepairSummary.empty("a"), repair.repairSenderSnapshots("a").join());
    }

    @Test
    void blankUserIdIsRejected() {
        assertEquals(ErrorCode.INVALID_ARGUMENT, codeOf(() -> repair.repairSenderSnapshots("")));
    }
}
