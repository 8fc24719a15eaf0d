package ch.so.arp.voice.persistence;

import java.util.Locale;

/**
 * Author of a {@link Message}. Stored in lower case.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromDbValue(String value) {
        return MessageRole.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
