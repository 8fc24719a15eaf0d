package ch.so.arp.voice.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Supplies the emitter for each streamed chat turn, so tests can hand the
 * controller a recording emitter.
 */
@FunctionalInterface
public interface SseEmitterFactory {

    SseEmitter create();
}
