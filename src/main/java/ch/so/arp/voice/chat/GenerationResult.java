package ch.so.arp.voice.chat;

/**
 * Outcome of a finished generation.
 *
 * @param status    terminal session state
 * @param content   text of the stored assistant message, possibly partial;
 *                  empty when nothing was stored
 * @param messageId id of the stored assistant message, {@code null} if none
 */
public record GenerationResult(SessionState status, String content, Long messageId, String correlationId) {
}
