package com.devportal.health;

import com.devportal.health.gateway.ProxyGateway;
import com.devportal.observability.ProbeMetrics;
import com.devportal.observability.ProbeTracing;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Shared wiring for engine tests: no-op tracing and an in-memory meter registry.
 */
final class EngineFixtures {

    static final Duration TEST_TIMEOUT = Duration.ofSeconds(5);

    private EngineFixtures() {
    }

    static ProbeMetrics metrics() {
        return new ProbeMetrics(new SimpleMeterRegistry(), "health-engine-test");
    }

    static ProbeTracing tracing() {
        return new ProbeTracing(OpenTelemetry.noop().getTracer("health-engine-test"));
    }

    static ProbeExecutor probeExecutor(ProxyGateway gateway, Executor executor) {
        return new ProbeExecutor(gateway, executor, TEST_TIMEOUT, metrics(), tracing());
    }

    static ProbeExecutor probeExecutor(ProxyGateway gateway, Executor executor, ProbeMetrics metrics) {
        return new ProbeExecutor(gateway, executor, TEST_TIMEOUT, metrics, tracing());
    }
}
