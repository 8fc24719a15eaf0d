package ch.so.arp.voice.chat;

/**
 * Lifecycle of a stream session. {@code COMPLETED}, {@code CANCELLED} and
 * {@code FAILED} are terminal.
 */
public enum SessionState {
    IDLE,
    COMPOSING,
    STREAMING,
    FINALIZING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
