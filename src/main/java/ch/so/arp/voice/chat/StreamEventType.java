package ch.so.arp.voice.chat;

/**
 * Event names on the chat stream.
 */
public enum StreamEventType {
    CONTENT("content", false),
    DONE("done", true),
    ERROR("error", true),
    RESET("reset", false);

    private final String eventName;
    private final boolean terminal;

    StreamEventType(String eventName, boolean terminal) {
        this.eventName = eventName;
        this.terminal = terminal;
    }

    public String eventName() {
        return eventName;
    }

    /**
     * @return {@code true} for the events that end a stream
     */
    public boolean isTerminal() {
        return terminal;
    }
}
