package ch.so.arp.voice.persistence;

import java.time.Instant;

/**
 * Raw text uploaded for a voice profile. Immutable once stored.
 */
public record WritingSample(long id, long voiceProfileId, String fileName, String content, Instant createdAt) {
}
