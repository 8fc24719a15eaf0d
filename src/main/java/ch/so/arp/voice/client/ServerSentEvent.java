package ch.so.arp.voice.client;

/**
 * One dispatched event of a {@code text/event-stream}.
 *
 * @param event event name, {@code message} when the stream named none
 * @param data  data lines joined with {@code \n}
 * @param id    last event id, may be {@code null}
 */
public record ServerSentEvent(String event, String data, String id) {
}
