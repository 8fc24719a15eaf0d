package ch.so.arp.voice.client;

/**
 * Callbacks for the events of a chat stream.
 */
public interface StreamEventListener {

    void onContent(String correlationId, String delta);

    void onReset(String correlationId);

    /**
     * @param status    {@code COMPLETED} or {@code CANCELLED}
     * @param messageId persisted assistant message, {@code null} if none was stored
     */
    void onDone(String correlationId, String status, Long messageId);

    void onError(String correlationId, String reason);
}
