package com.devportal.health;

import com.devportal.health.gateway.ProxyGateway;
import com.devportal.health.model.Component;
import com.devportal.health.model.ComponentHealthCheck;
import com.devportal.health.model.HealthSummary;
import com.devportal.health.model.Landscape;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.health.model.SystemInfoResult;
import com.devportal.observability.ProbeMetrics;
import com.devportal.observability.ProbeTracing;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Entry point used by the portal's data-fetching layer.
 * <p>
 * Exposes the three health call surfaces. All of them block until their work has
 * settled and report failures as values rather than exceptions. Only invalid arguments
 * throw.
 */
public final class HealthApi {

    private final ProbeExecutor probeExecutor;
    private final SystemInfoResolver systemInfoResolver;
    private final HealthBatchOrchestrator orchestrator;

    public HealthApi(ProbeExecutor probeExecutor, SystemInfoResolver systemInfoResolver,
                     HealthBatchOrchestrator orchestrator) {
        if (probeExecutor == null) {
            throw new IllegalArgumentException("probeExecutor must not be null");
        }
        if (systemInfoResolver == null) {
            throw new IllegalArgumentException("systemInfoResolver must not be null");
        }
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator must not be null");
        }
        this.probeExecutor = probeExecutor;
        this.systemInfoResolver = systemInfoResolver;
        this.orchestrator = orchestrator;
    }

    /**
     * Wires the engine around a gateway.
     *
     * @param gateway  proxy gateway port
     * @param executor executor running the blocking gateway calls
     * @param timeout  per-probe timeout
     * @param metrics  probe metrics
     * @param tracing  probe tracing
     * @param clock    clock for {@code lastChecked} timestamps
     */
    public static HealthApi create(ProxyGateway gateway, Executor executor, Duration timeout,
                                   ProbeMetrics metrics, ProbeTracing tracing, Clock clock) {
        ProbeExecutor probeExecutor = new ProbeExecutor(gateway, executor, timeout, metrics, tracing);
        return new HealthApi(probeExecutor,
                new SystemInfoResolver(probeExecutor),
                new HealthBatchOrchestrator(probeExecutor, metrics, clock));
    }

    public ProbeOutcome fetchHealthStatus(String url, CancellationToken token) {
        return probeExecutor.probe(url, token).join();
    }

    public SystemInfoResult fetchSystemInfo(Component component, Landscape landscape, CancellationToken token) {
        return systemInfoResolver.resolve(component, landscape, token);
    }

    public List<ComponentHealthCheck> fetchAllHealthStatuses(List<Component> components, Landscape landscape,
                                                             CancellationToken token, ProgressListener listener) {
        return orchestrator.checkAll(components, landscape, token, listener);
    }

    public HealthSummary summarize(List<ComponentHealthCheck> checks) {
        if (checks == null) {
            throw new IllegalArgumentException("checks must not be null");
        }
        return HealthSummary.of(checks);
    }
}
