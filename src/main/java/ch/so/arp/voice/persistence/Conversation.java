package ch.so.arp.voice.persistence;

import java.time.Instant;

public record Conversation(long id, String ownerId, String title, Instant createdAt, Instant updatedAt) {

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
