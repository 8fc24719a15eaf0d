package ch.so.arp.voice.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class CancellationTokenTest {

    @Test
    void firstCancellationWins() {
        CancellationToken token = new CancellationToken();

        assertThat(token.isCancellationRequested()).isFalse();
        assertThat(token.reason()).isNull();
        assertThat(token.cancel(CancellationReason.USER_STOP)).isTrue();
        assertThat(token.cancel(CancellationReason.IDLE_TIMEOUT)).isFalse();
        assertThat(token.reason()).isEqualTo(CancellationReason.USER_STOP);
    }

    @Test
    void runsCallbacksOnceOnCancellation() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel(CancellationReason.CLIENT_DISCONNECT);
        token.cancel(CancellationReason.USER_STOP);

        assertThat(calls).hasValue(1);
    }

    @Test
    void runsLateCallbackImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel(CancellationReason.USER_STOP);
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel(CancellationReason.USER_STOP);

        assertThat(calls).hasValue(1);
    }
}
