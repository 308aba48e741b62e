package com.devportal.health;

import com.devportal.health.gateway.ProxyGateway;
import com.devportal.health.gateway.ProxyResponse;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.observability.ProbeContextHolder;
import com.devportal.observability.ProbeMetrics;
import com.devportal.observability.ProbeTracing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Performs one proxied GET against a component URL and classifies the outcome.
 * <p>
 * The gateway call runs on the supplied {@link Executor}. The returned future always
 * completes normally with a {@link ProbeOutcome}; it completes as aborted as soon as the
 * {@link CancellationToken} is cancelled, and as a transport error once the per-probe
 * timeout expires. Timeout and response time are measured from the moment a worker starts
 * the call, so time spent queued behind other probes counts against neither. No retries
 * happen here.
 */
public final class ProbeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProbeExecutor.class);

    /** Default per-probe timeout, matching the proxy's own outbound client timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final long NOT_STARTED = Long.MIN_VALUE;

    private final ProxyGateway gateway;
    private final Executor executor;
    private final Duration timeout;
    private final ProbeMetrics metrics;
    private final ProbeTracing tracing;

    public ProbeExecutor(ProxyGateway gateway, Executor executor, Duration timeout,
                         ProbeMetrics metrics, ProbeTracing tracing) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (tracing == null) {
            throw new IllegalArgumentException("tracing must not be null");
        }
        this.gateway = gateway;
        this.executor = executor;
        this.timeout = timeout;
        this.metrics = metrics;
        this.tracing = tracing;
    }

    /**
     * Probes {@code url} through the proxy.
     *
     * @param url   fully-qualified component endpoint URL
     * @param token cancellation token shared with the caller
     * @return a future that always completes normally
     */
    public CompletableFuture<ProbeOutcome> probe(String url, CancellationToken token) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }

        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(record(url, ProbeOutcome.aborted(0)));
        }

        // Clock and timeout start when a worker picks the call up, not while it waits in the queue.
        AtomicLong startedAt = new AtomicLong(NOT_STARTED);
        CompletableFuture<ProxyResponse> call = new CompletableFuture<>();
        Callable<ProxyResponse> task = ProbeContextHolder.wrap(() -> tracing.traceProbe(url, () -> gateway.get(url)));
        try {
            executor.execute(() -> {
                if (call.isDone()) {
                    return;
                }
                startedAt.set(System.nanoTime());
                call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    call.complete(task.call());
                } catch (Throwable t) {
                    call.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        Runnable deregister = token.onCancel(() -> call.completeExceptionally(new ProbeCancelledException(url)));

        return call.handle((response, failure) -> {
            deregister.run();
            return classify(response, failure, token, elapsedMs(startedAt.get()));
        }).thenApply(outcome -> record(url, outcome));
    }

    /**
     * Returns the configured per-probe timeout.
     */
    public Duration timeout() {
        return timeout;
    }

    private ProbeOutcome classify(ProxyResponse response, Throwable failure, CancellationToken token, long elapsedMs) {
        if (failure != null) {
            Throwable cause = unwrap(failure);
            if (cause instanceof CancellationException || token.isCancelled()) {
                return ProbeOutcome.aborted(elapsedMs);
            }
            if (cause instanceof TimeoutException) {
                return ProbeOutcome.transportError("Request timed out after " + timeout.toMillis() + "ms", elapsedMs);
            }
            return ProbeOutcome.transportError(cause.getMessage(), elapsedMs);
        }
        if (response == null) {
            return ProbeOutcome.transportError("Proxy returned no response", elapsedMs);
        }
        if (response.componentFailed()) {
            return ProbeOutcome.upstreamError(response.statusCode(), elapsedMs);
        }
        return ProbeOutcome.success(response.body(), elapsedMs);
    }

    /**
     * Meters and logs a settled outcome. Failures here are logged and never change the outcome.
     */
    private ProbeOutcome record(String url, ProbeOutcome outcome) {
        try {
            metrics.recordProbe(outcomeTag(outcome), outcome.responseTimeMs());
            if (outcome.isSuccess()) {
                log.debug("Probe {} succeeded in {}ms", url, outcome.responseTimeMs());
            } else {
                log.debug("Probe {} failed ({}): {}", url, outcome.failure(), outcome.error());
            }
        } catch (RuntimeException e) {
            log.warn("Recording probe {} failed: {}", url, e.getMessage(), e);
        }
        return outcome;
    }

    private static String outcomeTag(ProbeOutcome outcome) {
        if (outcome.isSuccess()) {
            return ProbeMetrics.OUTCOME_SUCCESS;
        }
        return switch (outcome.failure()) {
            case ABORTED -> ProbeMetrics.OUTCOME_ABORTED;
            case UPSTREAM -> ProbeMetrics.OUTCOME_UPSTREAM;
            default -> ProbeMetrics.OUTCOME_TRANSPORT;
        };
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startNanos) {
        if (startNanos == NOT_STARTED) {
            return 0;
        }
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
}
