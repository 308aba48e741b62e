package com.devportal.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link ProbeContext} with SLF4J MDC bridge.
 * <p>
 * Probe work hops between pool threads, so the context never travels implicitly:
 * callers wrap each task with {@link #runWithContext} or {@link #supplyWithContext},
 * which install the context for the duration of the task and then restore whatever
 * the thread held before.
 */
public final class ProbeContextHolder {

    private static final ThreadLocal<ProbeContext> CONTEXT = new ThreadLocal<>();

    private ProbeContextHolder() {
        // Utility class
    }

    /**
     * Sets the probe context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(ProbeContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(ProbeContext.MDC_BATCH_ID, context.batchId());
        setMdc(ProbeContext.MDC_LANDSCAPE, context.landscape());
        setMdc(ProbeContext.MDC_COMPONENT_ID, context.componentId());
    }

    /**
     * Returns the current thread's probe context, if set.
     */
    public static Optional<ProbeContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the probe context and its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(ProbeContext.MDC_BATCH_ID);
        MDC.remove(ProbeContext.MDC_LANDSCAPE);
        MDC.remove(ProbeContext.MDC_COMPONENT_ID);
    }

    /**
     * Runs the task with the given context installed, then restores the previous one.
     */
    public static void runWithContext(ProbeContext context, Runnable task) {
        supplyWithContext(context, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Evaluates the supplier with the given context installed, then restores the previous one.
     */
    public static <T> T supplyWithContext(ProbeContext context, Supplier<T> supplier) {
        ProbeContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Wraps a callable so that it runs with the context captured at wrap time.
     * Returns the callable unchanged when no context is set.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        ProbeContext captured = CONTEXT.get();
        if (captured == null) {
            return callable;
        }
        return () -> {
            ProbeContext previous = CONTEXT.get();
            try {
                set(captured);
                return callable.call();
            } finally {
                if (previous != null) {
                    set(previous);
                } else {
                    clear();
                }
            }
        };
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
