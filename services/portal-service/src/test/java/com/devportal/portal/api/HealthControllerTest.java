package com.devportal.portal.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.devportal.health.HealthApi;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.health.testing.InMemoryProxyGateway;
import com.devportal.observability.ProbeMetrics;
import com.devportal.observability.ProbeTracing;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthController")
class HealthControllerTest {

    private static final String URL = "https://slow.cfapps.example.com/health";

    private ExecutorService pool;
    private InMemoryProxyGateway gateway;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        gateway = new InMemoryProxyGateway();
        HealthApi api = HealthApi.create(gateway, pool, Duration.ofSeconds(30),
                new ProbeMetrics(new SimpleMeterRegistry(), "controller-test"),
                new ProbeTracing(OpenTelemetry.noop().getTracer("controller-test")),
                Clock.systemUTC());
        controller = new HealthController(api);
    }

    @AfterEach
    void tearDown() {
        gateway.releaseAll();
        pool.shutdownNow();
    }

    @Test
    @DisplayName("settles in-flight calls as aborted on shutdown")
    void cancelsInFlightOnShutdown() throws Exception {
        gateway.hang(URL, Map.of("status", "UP"));

        CompletableFuture<ProbeOutcome> pending = CompletableFuture.supplyAsync(() -> controller.probe(URL));
        await().atMost(Duration.ofSeconds(2)).until(() -> controller.inFlightCount() == 1);
        controller.cancelInFlight();

        ProbeOutcome outcome = pending.get(2, TimeUnit.SECONDS);
        assertThat(outcome.isAborted()).isTrue();
        assertThat(controller.inFlightCount()).isZero();
    }

    @Test
    @DisplayName("forgets the token once a call completes")
    void releasesTokenAfterCall() {
        gateway.respond(URL, Map.of("status", "UP"));

        assertThat(controller.probe(URL).isSuccess()).isTrue();
        assertThat(controller.inFlightCount()).isZero();
    }
}
