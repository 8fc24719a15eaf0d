package ch.so.arp.voice.chat;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Typed event of a chat stream; {@code data} is serialised as the JSON payload.
 */
public record StreamEvent(StreamEventType type, Object data) {

    public static StreamEvent content(String delta, String correlationId) {
        return new StreamEvent(StreamEventType.CONTENT, new Content(delta, correlationId));
    }

    public static StreamEvent done(SessionState status, Long messageId, String correlationId) {
        return new StreamEvent(StreamEventType.DONE, new Done(status, messageId, correlationId));
    }

    public static StreamEvent error(String reason, String correlationId) {
        return new StreamEvent(StreamEventType.ERROR, new Failure(reason, correlationId));
    }

    public static StreamEvent reset(String correlationId) {
        return new StreamEvent(StreamEventType.RESET, new Reset(correlationId));
    }

    public record Content(String delta, String correlationId) {
    }

    public record Done(SessionState status, @JsonInclude(JsonInclude.Include.ALWAYS) Long messageId,
            String correlationId) {
    }

    public record Failure(String reason, String correlationId) {
    }

    public record Reset(String correlationId) {
    }
}
