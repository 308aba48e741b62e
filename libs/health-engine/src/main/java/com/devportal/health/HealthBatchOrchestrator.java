package com.devportal.health;

import com.devportal.health.model.Component;
import com.devportal.health.model.ComponentHealthCheck;
import com.devportal.health.model.HealthSummary;
import com.devportal.health.model.Landscape;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.observability.ProbeContext;
import com.devportal.observability.ProbeContextHolder;
import com.devportal.observability.ProbeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Checks the liveness of many components in one landscape concurrently.
 * <p>
 * Every component gets exactly one {@link ComponentHealthCheck}, whatever happens to its
 * probes: the primary {@code /health} URL is probed first, the subdomain-qualified URL
 * once more if the primary fails and the component has a subdomain, and any unexpected
 * exception becomes an ERROR record for that component alone. The call returns after
 * every component has settled, with results in input order.
 */
public final class HealthBatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(HealthBatchOrchestrator.class);

    private final ProbeExecutor probeExecutor;
    private final ProbeMetrics metrics;
    private final Clock clock;

    public HealthBatchOrchestrator(ProbeExecutor probeExecutor, ProbeMetrics metrics) {
        this(probeExecutor, metrics, Clock.systemUTC());
    }

    public HealthBatchOrchestrator(ProbeExecutor probeExecutor, ProbeMetrics metrics, Clock clock) {
        if (probeExecutor == null) {
            throw new IllegalArgumentException("probeExecutor must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.probeExecutor = probeExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Probes every component's health endpoint in {@code landscape}.
     *
     * @param components components to check; must not contain null
     * @param landscape  target landscape
     * @param token      cancellation token for the whole batch
     * @param listener   optional progress listener, may be null
     * @return one record per component, in input order
     * @throws IllegalArgumentException if the batch cannot start
     */
    public List<ComponentHealthCheck> checkAll(List<Component> components, Landscape landscape,
                                               CancellationToken token, ProgressListener listener) {
        if (components == null) {
            throw new IllegalArgumentException("components must not be null");
        }
        if (landscape == null) {
            throw new IllegalArgumentException("landscape must not be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }
        if (components.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("components must not contain null");
        }
        if (components.isEmpty()) {
            return List.of();
        }

        ProbeContext batchContext = new ProbeContext(UUID.randomUUID().toString(), landscape.name(), null);
        metrics.recordBatch(components.size());
        ProbeContextHolder.runWithContext(batchContext, () ->
                log.info("Checking health of {} components in landscape {}", components.size(), landscape.name()));

        Progress progress = new Progress(components.size(), listener);
        List<CompletableFuture<ComponentHealthCheck>> futures = new ArrayList<>(components.size());
        for (Component component : components) {
            futures.add(checkComponent(component, landscape, token, batchContext.forComponent(component.id()), progress));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ComponentHealthCheck> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ComponentHealthCheck> future : futures) {
            results.add(future.join());
        }

        ProbeContextHolder.runWithContext(batchContext, () ->
                log.info("Health batch finished for landscape {}: {}", landscape.name(),
                        HealthSummary.of(results)));
        return results;
    }

    private CompletableFuture<ComponentHealthCheck> checkComponent(Component component, Landscape landscape,
                                                                   CancellationToken token, ProbeContext context,
                                                                   Progress progress) {
        ComponentHealthCheck initial =
                ComponentHealthCheck.loading(component, landscape, EndpointResolver.healthUrl(component, landscape));

        CompletableFuture<ComponentHealthCheck> chain;
        try {
            chain = ProbeContextHolder.supplyWithContext(context, () -> probeExecutor.probe(initial.healthUrl(), token))
                    .thenCompose(primary -> ProbeContextHolder.supplyWithContext(context,
                            () -> afterPrimary(component, landscape, initial, primary, token)));
        } catch (RuntimeException e) {
            chain = CompletableFuture.failedFuture(e);
        }

        return chain.handle((check, failure) -> {
            ComponentHealthCheck settled = check;
            if (failure != null || check == null) {
                settled = ProbeContextHolder.supplyWithContext(context, () -> isolate(initial, failure));
            }
            progress.completed();
            return settled;
        });
    }

    private CompletableFuture<ComponentHealthCheck> afterPrimary(Component component, Landscape landscape,
                                                                 ComponentHealthCheck initial, ProbeOutcome primary,
                                                                 CancellationToken token) {
        if (primary.isSuccess()) {
            return CompletableFuture.completedFuture(initial.succeeded(initial.healthUrl(), primary, clock.instant()));
        }
        Optional<String> subdomain = component.subdomain();
        if (subdomain.isEmpty()) {
            return CompletableFuture.completedFuture(initial.failed(primary, clock.instant()));
        }

        String fallbackUrl = EndpointResolver.healthUrl(component, landscape, subdomain.get());
        log.debug("Primary health probe failed for {}, trying {}", component.name(), fallbackUrl);
        return probeExecutor.probe(fallbackUrl, token).thenApply(fallback -> fallback.isSuccess()
                ? initial.succeeded(fallbackUrl, fallback, clock.instant())
                : initial.failed(fallback, clock.instant()));
    }

    private ComponentHealthCheck isolate(ComponentHealthCheck initial, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        String message = cause != null ? cause.getMessage() : null;
        log.warn("Health check for {} failed unexpectedly: {}", initial.componentName(), message, cause);
        return initial.isolationFailure(message, clock.instant());
    }

    /**
     * Settlement counter; listener calls happen under the lock so counts arrive in order.
     */
    private static final class Progress {

        private final int total;
        private final ProgressListener listener;
        private int completed;

        Progress(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }

        synchronized void completed() {
            completed++;
            if (listener == null) {
                return;
            }
            try {
                listener.onProgress(completed, total);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at {}/{}: {}", completed, total, e.getMessage(), e);
            }
        }
    }
}
