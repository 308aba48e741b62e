package com.devportal.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-owned cancellation signal, passed explicitly through every health call.
 * <p>
 * {@link #cancel()} is idempotent. Listeners run exactly once: on cancellation, or
 * immediately on registration if the token is already cancelled. Callers that outlive
 * their interest in the token deregister through the handle {@link #onCancel} returns.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * Returns a fresh, uncancelled token.
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Returns a token that is already cancelled.
     */
    public static CancellationToken cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        return token;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancels the token and notifies registered listeners on the calling thread.
     */
    public void cancel() {
        List<Runnable> toNotify;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toNotify) {
            notifyListener(listener);
        }
    }

    /**
     * Registers a listener to run on cancellation.
     *
     * @return a handle that deregisters the listener; a no-op once the token is cancelled
     */
    public Runnable onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        synchronized (lock) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> deregister(listener);
            }
        }
        notifyListener(listener);
        return () -> { };
    }

    int listenerCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    private void deregister(Runnable listener) {
        synchronized (lock) {
            listeners.removeIf(registered -> registered == listener);
        }
    }

    private static void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
