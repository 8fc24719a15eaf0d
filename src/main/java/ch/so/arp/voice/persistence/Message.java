package ch.so.arp.voice.persistence;

import java.time.Instant;

/**
 * Persisted chat turn. Content is never blank.
 */
public record Message(
        long id,
        long conversationId,
        MessageRole role,
        String content,
        String model,
        Long voiceProfileId,
        Instant createdAt) {
}
