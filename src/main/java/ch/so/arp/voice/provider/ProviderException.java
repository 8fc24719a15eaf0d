package ch.so.arp.voice.provider;

/**
 * Failure talking to a model vendor. The message is for logs only and never
 * reaches the chat client.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final int statusCode;

    public ProviderException(String provider, String message) {
        this(provider, message, -1, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        this(provider, message, -1, cause);
    }

    public ProviderException(String provider, String message, int statusCode, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String provider() {
        return provider;
    }

    /**
     * @return HTTP status returned by the vendor, or {@code -1} if none was received
     */
    public int statusCode() {
        return statusCode;
    }
}
