package ch.so.arp.voice;

/**
 * Signals a request that cannot be processed as sent, e.g. a blank message or
 * an unknown model. Raised before any external call is made.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
