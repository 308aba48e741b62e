package com.devportal.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.devportal.health.model.Component;
import com.devportal.health.model.ComponentHealthCheck;
import com.devportal.health.model.HealthSummary;
import com.devportal.health.model.Landscape;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.health.model.SystemInfoResult;
import com.devportal.health.testing.InMemoryProxyGateway;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthApi")
class HealthApiTest {

    private static final Landscape EU10 = new Landscape("eu10", "example.com");

    private ExecutorService pool;
    private InMemoryProxyGateway gateway;
    private HealthApi api;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        gateway = new InMemoryProxyGateway();
        api = HealthApi.create(gateway, pool, Duration.ofSeconds(5), EngineFixtures.metrics(),
                EngineFixtures.tracing(), Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("fetches a single health status")
    void fetchHealthStatus() {
        gateway.respond("https://accounts.cfapps.example.com/health", Map.of("status", "UP"));

        ProbeOutcome outcome = api.fetchHealthStatus("https://accounts.cfapps.example.com/health",
                CancellationToken.create());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.data()).containsEntry("status", "UP");
    }

    @Test
    @DisplayName("fetches system info through the resolver")
    void fetchSystemInfo() {
        gateway.respond("https://billing.cfapps.example.com/systemInformation/public", Map.of("version", "3.1"));

        SystemInfoResult result = api.fetchSystemInfo(Component.of("c2", "Billing"), EU10, CancellationToken.create());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.url()).isEqualTo("https://billing.cfapps.example.com/systemInformation/public");
    }

    @Test
    @DisplayName("checks a batch and summarizes it")
    void fetchAllAndSummarize() {
        gateway.respond("https://a.cfapps.example.com/health", Map.of("status", "UP"))
                .respond("https://b.cfapps.example.com/health", Map.of("status", "DOWN"))
                .respondComponentFailure("https://c.cfapps.example.com/health", 500);

        List<ComponentHealthCheck> checks = api.fetchAllHealthStatuses(
                List.of(Component.of("1", "a"), Component.of("2", "b"), Component.of("3", "c")),
                EU10, CancellationToken.create(), null);
        HealthSummary summary = api.summarize(checks);

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.up()).isEqualTo(1);
        assertThat(summary.down()).isEqualTo(1);
        assertThat(summary.error()).isEqualTo(1);
        assertThat(summary.unknown()).isZero();
    }

    @Test
    @DisplayName("rejects a null list to summarize")
    void summarizeRejectsNull() {
        assertThatThrownBy(() -> api.summarize(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
