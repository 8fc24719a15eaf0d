package ch.so.arp.voice.provider;

public enum CancellationReason {
    /** The user pressed stop. */
    USER_STOP,
    /** The client went away while the response was streaming. */
    CLIENT_DISCONNECT,
    /** No delta arrived within the configured idle timeout. */
    IDLE_TIMEOUT
}
