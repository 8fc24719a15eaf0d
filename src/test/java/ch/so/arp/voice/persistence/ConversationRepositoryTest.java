package ch.so.arp.voice.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConversationRepositoryTest {

    private final ConversationRepository conversations = TestDatabase.create().conversations();

    @Test
    void createsUntitledConversation() {
        Conversation conversation = conversations.create("alice", null);

        assertThat(conversation.hasTitle()).isFalse();
        assertThat(conversation.isOwnedBy("alice")).isTrue();
        assertThat(conversation.isOwnedBy("bob")).isFalse();
    }

    @Test
    void updatesTitle() {
        Conversation conversation = conversations.create("alice", null);

        conversations.updateTitle(conversation.id(), "Trip planning");

        assertThat(conversations.findById(conversation.id())).map(Conversation::title).contains("Trip planning");
    }
}
