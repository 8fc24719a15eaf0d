package ch.so.arp.voice.prompt;

import java.util.Objects;

import ch.so.arp.voice.persistence.MessageRole;

/**
 * Role-tagged message handed to a provider adapter.
 */
public record ChatTurn(MessageRole role, String content) {

    public ChatTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(MessageRole.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(MessageRole.ASSISTANT, content);
    }
}
