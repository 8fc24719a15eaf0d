package ch.so.arp.voice.chat;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One user turn.
 *
 * @param conversationId existing conversation of the user
 * @param message        the user's text
 * @param model          catalog model id, the configured default when absent
 * @param voiceProfileId voice to answer in, the user's active profile when absent
 * @param correlationId  client generated id echoed on every stream event
 */
public record ChatRequest(
        @NotNull Long conversationId,
        @NotBlank String message,
        String model,
        Long voiceProfileId,
        String correlationId) {
}
