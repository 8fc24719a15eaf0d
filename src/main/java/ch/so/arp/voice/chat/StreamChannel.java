package ch.so.arp.voice.chat;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, non-blocking event pipe between one stream session and its
 * subscriber. {@link #publish} only enqueues; a single drain task at a time
 * delivers the queued events on the dispatch executor, so events arrive in
 * publication order. After a terminal event nothing more is accepted, and a
 * failing subscriber stops delivery and is reported once to the failure
 * handler.
 */
public class StreamChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamChannel.class);

    private final StreamSubscriber subscriber;
    private final Executor dispatchExecutor;
    private final Queue<StreamEvent> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile Consumer<Throwable> failureHandler = ex -> {
    };

    public StreamChannel(StreamSubscriber subscriber, Executor dispatchExecutor) {
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    }

    public void onSubscriberFailure(Consumer<Throwable> handler) {
        this.failureHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Queues the event for delivery.
     *
     * @return {@code false} if the channel already saw its terminal event
     */
    public boolean publish(StreamEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.type().isTerminal()) {
            if (!closed.compareAndSet(false, true)) {
                return false;
            }
        } else if (closed.get()) {
            LOGGER.debug("Dropping {} event published after the stream ended", event.type().eventName());
            return false;
        }
        pending.add(event);
        scheduleDrain();
        return true;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean hasFailed() {
        return failed.get();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                dispatchExecutor.execute(this::drain);
            } catch (RuntimeException ex) {
                draining.set(false);
                fail(ex);
            }
        }
    }

    private void drain() {
        try {
            StreamEvent event;
            while ((event = pending.poll()) != null) {
                if (failed.get()) {
                    continue;
                }
                try {
                    subscriber.deliver(event);
                } catch (Exception ex) {
                    fail(ex);
                    continue;
                }
                if (event.type().isTerminal()) {
                    completeSubscriber();
                }
            }
        } finally {
            draining.set(false);
        }
        if (!pending.isEmpty()) {
            scheduleDrain();
        }
    }

    private void completeSubscriber() {
        try {
            subscriber.complete();
        } catch (RuntimeException ex) {
            LOGGER.debug("Completing the stream subscriber failed: {}", ex.getMessage());
        }
    }

    private void fail(Throwable ex) {
        if (failed.compareAndSet(false, true)) {
            pending.clear();
            LOGGER.warn("Stream subscriber failed, stopping delivery: {}", ex.getMessage());
            failureHandler.accept(ex);
        }
    }
}
