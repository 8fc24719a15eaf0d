package ch.so.arp.voice.client;

/**
 * One rendered entry of the conversation view.
 */
public record ChatBubble(Kind kind, String role, String content, Long messageId, String correlationId) {

    public enum Kind {
        /** Stored on the server. */
        PERSISTED,
        /** User turn shown before the server confirmed it. */
        OPTIMISTIC,
        /** Answer text streaming in. */
        TYPING,
        /** Notice of a turn that failed. */
        FAILED
    }
}
