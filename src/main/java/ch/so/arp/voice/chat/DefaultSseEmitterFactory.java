package ch.so.arp.voice.chat;

import java.time.Duration;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates emitters with the configured timeout. A zero timeout means none, so
 * long answers can finish; stalled providers are handled by the idle watchdog.
 */
class DefaultSseEmitterFactory implements SseEmitterFactory {

    private final Long timeoutMillis;

    DefaultSseEmitterFactory(Duration timeout) {
        this.timeoutMillis = timeout == null ? 0L : timeout.toMillis();
    }

    @Override
    public SseEmitter create() {
        return new SseEmitter(timeoutMillis);
    }
}
