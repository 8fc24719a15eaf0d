package ch.so.arp.voice.chat;

import java.io.IOException;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes stream events to an {@link SseEmitter} as named events with a JSON
 * payload.
 */
class SseStreamSubscriber implements StreamSubscriber {

    private final SseEmitter emitter;

    SseStreamSubscriber(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void deliver(StreamEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.type().eventName())
                .data(event.data(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
