package ch.so.arp.voice.chat;

import java.io.IOException;

/**
 * Receiver of the events of one stream session.
 */
public interface StreamSubscriber {

    /**
     * Delivers one event. An exception means the receiver is gone.
     */
    void deliver(StreamEvent event) throws IOException;

    /**
     * Called once after the terminal event was delivered.
     */
    default void complete() {
    }

    StreamSubscriber NONE = event -> {
    };
}
