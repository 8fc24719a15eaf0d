package ch.so.arp.voice.chat;

/**
 * A turn could not be started, e.g. because the user message could not be stored.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
