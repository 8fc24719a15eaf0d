package ch.so.arp.voice.prompt;

import java.util.List;

/**
 * Provider-neutral generation request. The last entry of {@code messages} is
 * always the new user turn.
 */
public record ComposedRequest(String systemInstruction, List<ChatTurn> messages) {

    public ComposedRequest {
        messages = List.copyOf(messages);
    }

    public ChatTurn lastTurn() {
        return messages.get(messages.size() - 1);
    }
}
