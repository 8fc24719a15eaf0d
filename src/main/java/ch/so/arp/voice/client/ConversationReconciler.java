package ch.so.arp.voice.client;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side view of one conversation that merges optimistic state with the
 * persisted history. Turns are keyed by a client generated correlation id:
 * a turn is pending from {@link #submit} until its {@code done} or
 * {@code error} event, after which further events carrying its id are
 * ignored. The view lists persisted messages first, then pending user turns,
 * then the typing buffer.
 */
public class ConversationReconciler implements StreamEventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationReconciler.class);

    private final Supplier<List<PersistedMessage>> historyLoader;
    private final Map<String, String> pendingTurns = new LinkedHashMap<>();
    private final Map<String, String> failedTurns = new LinkedHashMap<>();
    private final Set<String> resolved = new HashSet<>();
    private final StringBuilder typingBuffer = new StringBuilder();
    private List<PersistedMessage> persisted = List.of();
    private String streamingCorrelationId;

    public ConversationReconciler(Supplier<List<PersistedMessage>> historyLoader) {
        this.historyLoader = Objects.requireNonNull(historyLoader, "historyLoader");
    }

    /**
     * Loads the persisted history, e.g. when a conversation is opened.
     */
    public synchronized void refresh() {
        persisted = List.copyOf(historyLoader.get());
        pendingTurns.keySet().removeIf(resolved::contains);
    }

    /**
     * Shows the user's text right away and returns the correlation id to send
     * along with the request.
     */
    public synchronized String submit(String text) {
        String correlationId = UUID.randomUUID().toString();
        pendingTurns.put(correlationId, text);
        streamingCorrelationId = correlationId;
        typingBuffer.setLength(0);
        return correlationId;
    }

    @Override
    public synchronized void onContent(String correlationId, String delta) {
        if (!isStreaming(correlationId)) {
            return;
        }
        typingBuffer.append(delta);
    }

    @Override
    public synchronized void onReset(String correlationId) {
        if (isStreaming(correlationId)) {
            typingBuffer.setLength(0);
        }
    }

    @Override
    public synchronized void onDone(String correlationId, String status, Long messageId) {
        if (!resolve(correlationId)) {
            return;
        }
        LOGGER.debug("Turn {} done with status {} (message {})", correlationId, status, messageId);
    }

    @Override
    public synchronized void onError(String correlationId, String reason) {
        if (!resolve(correlationId)) {
            return;
        }
        failedTurns.put(correlationId, reason);
    }

    public synchronized List<ChatBubble> view() {
        List<ChatBubble> bubbles = new ArrayList<>();
        for (PersistedMessage message : persisted) {
            bubbles.add(new ChatBubble(ChatBubble.Kind.PERSISTED, message.role(), message.content(), message.id(),
                    null));
        }
        failedTurns.forEach((correlationId, reason) -> bubbles
                .add(new ChatBubble(ChatBubble.Kind.FAILED, "assistant", reason, null, correlationId)));
        pendingTurns.forEach((correlationId, text) -> bubbles
                .add(new ChatBubble(ChatBubble.Kind.OPTIMISTIC, "user", text, null, correlationId)));
        if (typingBuffer.length() > 0) {
            bubbles.add(new ChatBubble(ChatBubble.Kind.TYPING, "assistant", typingBuffer.toString(), null,
                    streamingCorrelationId));
        }
        return bubbles;
    }

    public synchronized String typingText() {
        return typingBuffer.toString();
    }

    public synchronized boolean isPending(String correlationId) {
        return pendingTurns.containsKey(correlationId);
    }

    private boolean isStreaming(String correlationId) {
        return correlationId != null && correlationId.equals(streamingCorrelationId)
                && !resolved.contains(correlationId);
    }

    /**
     * Ends a pending turn once: clears the typing buffer, reloads the history
     * and drops the optimistic bubble.
     *
     * @return {@code false} if the turn was already resolved or is unknown
     */
    private boolean resolve(String correlationId) {
        if (correlationId == null || !pendingTurns.containsKey(correlationId) || !resolved.add(correlationId)) {
            return false;
        }
        if (correlationId.equals(streamingCorrelationId)) {
            typingBuffer.setLength(0);
            streamingCorrelationId = null;
        }
        try {
            persisted = List.copyOf(historyLoader.get());
            pendingTurns.remove(correlationId);
        } catch (RuntimeException ex) {
            // the optimistic bubble stays until the next successful refresh
            LOGGER.warn("Reloading the history after turn {} failed: {}", correlationId, ex.getMessage());
        }
        return true;
    }
}
