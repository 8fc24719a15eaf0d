package ch.so.arp.voice.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Message as returned by the history endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedMessage(long id, String role, String content, String model, String createdAt) {
}
