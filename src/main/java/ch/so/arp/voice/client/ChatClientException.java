package ch.so.arp.voice.client;

public class ChatClientException extends RuntimeException {

    private final int statusCode;

    public ChatClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ChatClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() {
        return statusCode;
    }
}
