package ch.so.arp.voice.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import ch.so.arp.voice.client.ChatBubble.Kind;

class ConversationReconcilerTest {

    private final List<PersistedMessage> serverHistory = new ArrayList<>();
    private final AtomicBoolean serverDown = new AtomicBoolean();
    private final ConversationReconciler reconciler = new ConversationReconciler(() -> {
        if (serverDown.get()) {
            throw new ChatClientException("HTTP 503", 503);
        }
        return List.copyOf(serverHistory);
    });

    @Test
    void showsSubmittedTextBeforeTheServerConfirmsIt() {
        serverHistory.add(message(1, "user", "Earlier"));
        reconciler.refresh();

        String correlationId = reconciler.submit("Hello there");

        assertThat(reconciler.isPending(correlationId)).isTrue();
        assertThat(reconciler.view()).extracting(ChatBubble::kind, ChatBubble::content)
                .containsExactly(
                        tuple(Kind.PERSISTED, "Earlier"),
                        tuple(Kind.OPTIMISTIC, "Hello there"));
    }

    @Test
    void accumulatesTypingTextAndClearsItOnReset() {
        String correlationId = reconciler.submit("Hi");

        reconciler.onContent(correlationId, "Hel");
        reconciler.onContent(correlationId, "lo");
        assertThat(reconciler.typingText()).isEqualTo("Hello");
        assertThat(reconciler.view()).last()
                .satisfies(bubble -> {
                    assertThat(bubble.kind()).isEqualTo(Kind.TYPING);
                    assertThat(bubble.correlationId()).isEqualTo(correlationId);
                });

        reconciler.onReset(correlationId);
        assertThat(reconciler.typingText()).isEmpty();
        reconciler.onContent(correlationId, "Fresh");
        assertThat(reconciler.typingText()).isEqualTo("Fresh");
    }

    @Test
    void doneReplacesOptimisticStateWithPersistedHistory() {
        String correlationId = reconciler.submit("Hi");
        reconciler.onContent(correlationId, "Hello");
        serverHistory.add(message(1, "user", "Hi"));
        serverHistory.add(message(2, "assistant", "Hello"));

        reconciler.onDone(correlationId, "COMPLETED", 2L);

        assertThat(reconciler.isPending(correlationId)).isFalse();
        assertThat(reconciler.typingText()).isEmpty();
        assertThat(reconciler.view()).extracting(ChatBubble::kind).containsOnly(Kind.PERSISTED);
        assertThat(reconciler.view()).extracting(ChatBubble::messageId).containsExactly(1L, 2L);
    }

    @Test
    void errorLeavesFailureNotice() {
        String correlationId = reconciler.submit("Hi");
        reconciler.onContent(correlationId, "Partial");
        serverHistory.add(message(1, "user", "Hi"));
        serverHistory.add(message(2, "assistant", "Partial"));

        reconciler.onError(correlationId, "Sorry, something went wrong.");

        assertThat(reconciler.view()).extracting(ChatBubble::kind)
                .containsExactly(Kind.PERSISTED, Kind.PERSISTED, Kind.FAILED);
        assertThat(reconciler.view()).last()
                .extracting(ChatBubble::content)
                .isEqualTo("Sorry, something went wrong.");
    }

    @Test
    void keepsOptimisticBubbleWhenReloadFails() {
        String correlationId = reconciler.submit("Hi");
        serverDown.set(true);

        reconciler.onDone(correlationId, "COMPLETED", 2L);

        assertThat(reconciler.isPending(correlationId)).isTrue();
        assertThat(reconciler.view()).extracting(ChatBubble::kind).containsExactly(Kind.OPTIMISTIC);

        serverDown.set(false);
        serverHistory.add(message(1, "user", "Hi"));
        reconciler.refresh();

        assertThat(reconciler.isPending(correlationId)).isFalse();
        assertThat(reconciler.view()).extracting(ChatBubble::kind).containsExactly(Kind.PERSISTED);
    }

    @Test
    void ignoresEventsOfResolvedOrUnknownTurns() {
        String first = reconciler.submit("One");
        reconciler.onDone(first, "COMPLETED", 1L);
        String second = reconciler.submit("Two");

        reconciler.onContent(first, "stale");
        reconciler.onContent("unknown", "noise");
        reconciler.onError(first, "late failure");
        reconciler.onDone(first, "COMPLETED", 1L);
        reconciler.onContent(second, "fresh");

        assertThat(reconciler.typingText()).isEqualTo("fresh");
        assertThat(reconciler.view()).extracting(ChatBubble::kind).doesNotContain(Kind.FAILED);
        assertThat(reconciler.isPending(second)).isTrue();
    }

    @Test
    void newSubmissionStartsWithEmptyTypingBuffer() {
        String first = reconciler.submit("One");
        reconciler.onContent(first, "abandoned");

        String second = reconciler.submit("Two");

        assertThat(reconciler.typingText()).isEmpty();
        reconciler.onContent(first, "late");
        assertThat(reconciler.typingText()).isEmpty();
        reconciler.onContent(second, "ok");
        assertThat(reconciler.typingText()).isEqualTo("ok");
    }

    private static PersistedMessage message(long id, String role, String content) {
        return new PersistedMessage(id, role, content, null, "2026-01-01T10:00:00Z");
    }
}
