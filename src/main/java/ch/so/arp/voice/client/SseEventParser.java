package ch.so.arp.voice.client;

import java.util.ArrayList;
import java.util.List;

/**
 * Incremental parser for {@code text/event-stream} bodies. Input may be fed in
 * arbitrary pieces; an event is dispatched on the blank line that ends it.
 * Comment lines (starting with {@code :}) and unknown fields are ignored.
 */
public class SseEventParser {

    static final String DEFAULT_EVENT = "message";

    private final StringBuilder partialLine = new StringBuilder();
    private final StringBuilder data = new StringBuilder();
    private boolean hasData;
    private String eventName;
    private String lastEventId;
    private boolean skipLineFeed;

    /**
     * Feeds a piece of the body.
     *
     * @return events completed by this piece, in stream order
     */
    public List<ServerSentEvent> feed(CharSequence chunk) {
        List<ServerSentEvent> events = new ArrayList<>();
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (skipLineFeed) {
                skipLineFeed = false;
                if (c == '\n') {
                    continue;
                }
            }
            if (c == '\r' || c == '\n') {
                skipLineFeed = c == '\r';
                ServerSentEvent event = line(partialLine.toString());
                partialLine.setLength(0);
                if (event != null) {
                    events.add(event);
                }
            } else {
                partialLine.append(c);
            }
        }
        return events;
    }

    /**
     * Processes one complete line without its terminator.
     *
     * @return the dispatched event if the line was blank and ended one
     */
    public ServerSentEvent line(String line) {
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.startsWith(":")) {
            return null;
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            case "id" -> lastEventId = value;
            default -> {
                // retry and unknown fields carry nothing for us
            }
        }
        return null;
    }

    private ServerSentEvent dispatch() {
        if (!hasData) {
            eventName = null;
            return null;
        }
        ServerSentEvent event = new ServerSentEvent(eventName != null && !eventName.isEmpty() ? eventName
                : DEFAULT_EVENT, data.toString(), lastEventId);
        data.setLength(0);
        hasData = false;
        eventName = null;
        return event;
    }
}
