package ch.so.arp.voice.provider;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal shared between a stream session and the
 * provider adapter reading the vendor stream. The first {@link #cancel} wins;
 * later calls keep the original reason.
 */
public final class CancellationToken {

    private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicReference<CancellationReason> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel(CancellationReason cancellationReason) {
        if (!reason.compareAndSet(null, cancellationReason)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
        return true;
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    /**
     * @return the reason of the cancellation or {@code null} while not cancelled
     */
    public CancellationReason reason() {
        return reason.get();
    }

    /**
     * Registers a callback run once on cancellation, or right away when the
     * token is already cancelled. Adapters use it to close a blocked read.
     */
    public void onCancel(Runnable callback) {
        AtomicBoolean ran = new AtomicBoolean();
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        if (isCancellationRequested()) {
            runQuietly(once);
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Cancellation callback failed: {}", ex.getMessage(), ex);
        }
    }
}
