package ch.so.arp.voice.chat;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import ch.so.arp.voice.provider.CancellationReason;
import ch.so.arp.voice.provider.CancellationToken;

/**
 * State of one generation from the moment the user turn was accepted until the
 * assistant turn is stored. Deltas are accumulated in a buffer and published
 * on the session's channel; once finalization began no delta is accepted.
 */
public class StreamSession {

    private final String sessionId;
    private final String ownerId;
    private final long conversationId;
    private final String correlationId;
    private final String modelId;
    private final Long voiceProfileId;
    private final StreamChannel channel;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final StringBuilder buffer = new StringBuilder();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final AtomicBoolean finalized = new AtomicBoolean();
    private final AtomicLong lastActivityNanos = new AtomicLong(System.nanoTime());
    private final CompletableFuture<GenerationResult> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> watchdog;
    private volatile long userMessageId;

    StreamSession(String sessionId, String ownerId, long conversationId, String correlationId, String modelId,
            Long voiceProfileId, StreamChannel channel) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.conversationId = conversationId;
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.modelId = Objects.requireNonNull(modelId, "modelId");
        this.voiceProfileId = voiceProfileId;
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    public String sessionId() {
        return sessionId;
    }

    public String ownerId() {
        return ownerId;
    }

    public long conversationId() {
        return conversationId;
    }

    public String correlationId() {
        return correlationId;
    }

    public String modelId() {
        return modelId;
    }

    public Long voiceProfileId() {
        return voiceProfileId;
    }

    public SessionState state() {
        return state.get();
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    /**
     * Result available once the session reached a terminal state.
     */
    public CompletableFuture<GenerationResult> result() {
        return result;
    }

    /**
     * Requests cancellation. Has no effect once the session is finalizing.
     */
    public boolean cancel(CancellationReason reason) {
        if (finalized.get()) {
            return false;
        }
        return cancellationToken.cancel(reason);
    }

    StreamChannel channel() {
        return channel;
    }

    void transition(SessionState next) {
        state.set(next);
    }

    /**
     * Appends a delta and publishes it.
     *
     * @return {@code false} if the session no longer accepts deltas
     */
    boolean appendDelta(String delta) {
        if (delta == null || delta.isEmpty()) {
            return true;
        }
        synchronized (buffer) {
            if (finalized.get() || cancellationToken.isCancellationRequested()) {
                return false;
            }
            buffer.append(delta);
            touch();
            channel.publish(StreamEvent.content(delta, correlationId));
        }
        return true;
    }

    String bufferedText() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }

    /**
     * Marks the session as finalizing. Only the first caller gets {@code true};
     * the buffer is frozen from then on.
     */
    boolean beginFinalize() {
        synchronized (buffer) {
            return finalized.compareAndSet(false, true);
        }
    }

    boolean isFinalized() {
        return finalized.get();
    }

    void touch() {
        lastActivityNanos.set(System.nanoTime());
    }

    long idleNanos() {
        return System.nanoTime() - lastActivityNanos.get();
    }

    void watchdog(ScheduledFuture<?> watchdog) {
        this.watchdog = watchdog;
    }

    void stopWatchdog() {
        ScheduledFuture<?> current = watchdog;
        if (current != null) {
            current.cancel(false);
        }
    }

    long userMessageId() {
        return userMessageId;
    }

    void userMessageId(long userMessageId) {
        this.userMessageId = userMessageId;
    }
}
