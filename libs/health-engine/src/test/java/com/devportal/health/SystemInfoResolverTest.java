package com.devportal.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.devportal.health.gateway.ProxyGatewayException;
import com.devportal.health.model.Component;
import com.devportal.health.model.FailureKind;
import com.devportal.health.model.Landscape;
import com.devportal.health.model.ResultStatus;
import com.devportal.health.model.SystemInfoResult;
import com.devportal.health.testing.InMemoryProxyGateway;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SystemInfoResolver}: variant order, early exit, skipping and exhaustion.
 */
@DisplayName("SystemInfoResolver")
class SystemInfoResolverTest {

    private static final Landscape EU10 = new Landscape("eu10", "example.com");

    private static final String INFO = "https://billing.cfapps.example.com/systemInformation/public";
    private static final String INFO_SUB = "https://sap-x.billing.cfapps.example.com/systemInformation/public";
    private static final String VERSION = "https://billing.cfapps.example.com/version";
    private static final String VERSION_SUB = "https://sap-x.billing.cfapps.example.com/version";

    private ExecutorService pool;
    private InMemoryProxyGateway gateway;
    private SystemInfoResolver resolver;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        gateway = new InMemoryProxyGateway();
        resolver = new SystemInfoResolver(EngineFixtures.probeExecutor(gateway, pool));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("returns the primary endpoint when it answers and stops there")
    void primarySucceeds() {
        gateway.respond(INFO, Map.of("buildProperties", Map.of("version", "2.4.1")));

        SystemInfoResult result = resolver.resolve(Component.withSubdomain("c2", "Billing", "sap-x"), EU10,
                CancellationToken.create());

        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.url()).isEqualTo(INFO);
        assertThat(result.data()).containsKey("buildProperties");
        assertThat(gateway.calls()).containsExactly(INFO);
    }

    @Test
    @DisplayName("walks all four variants in order and returns the fourth")
    void fourthVariantSucceeds() {
        gateway.respondComponentFailure(INFO, 404)
                .fail(INFO_SUB, new ProxyGatewayException("connection reset"))
                .respondComponentFailure(VERSION, 500)
                .respond(VERSION_SUB, Map.of("app", "1.9.0"));

        SystemInfoResult result = resolver.resolve(Component.withSubdomain("c2", "Billing", "sap-x"), EU10,
                CancellationToken.create());

        assertThat(result.status()).isEqualTo(ResultStatus.SUCCESS);
        assertThat(result.url()).isEqualTo(VERSION_SUB);
        assertThat(result.data()).containsEntry("app", "1.9.0");
        assertThat(gateway.calls()).containsExactly(INFO, INFO_SUB, VERSION, VERSION_SUB);
    }

    @Test
    @DisplayName("falls through to the legacy /version endpoint")
    void legacyVersionSucceeds() {
        gateway.respondComponentFailure(INFO, 404)
                .respond(VERSION, Map.of("app", "1.2.3"));

        SystemInfoResult result = resolver.resolve(Component.of("c2", "Billing"), EU10, CancellationToken.create());

        assertThat(result.url()).isEqualTo(VERSION);
        assertThat(gateway.calls()).containsExactly(INFO, VERSION);
    }

    @Test
    @DisplayName("gives up after the two non-subdomain variants when there is no subdomain")
    void exhaustsWithoutSubdomain() {
        gateway.respondComponentFailure(INFO, 404)
                .respondComponentFailure(VERSION, 404);

        SystemInfoResult result = resolver.resolve(Component.of("c2", "Billing"), EU10, CancellationToken.create());

        assertThat(result.status()).isEqualTo(ResultStatus.ERROR);
        assertThat(result.error()).isEqualTo("All system info endpoints failed");
        assertThat(result.failure()).isEqualTo(FailureKind.EXHAUSTED);
        assertThat(result.data()).isNull();
        assertThat(result.url()).isNull();
        assertThat(gateway.calls()).containsExactly(INFO, VERSION);
    }

    @Test
    @DisplayName("skips subdomain variants when the subdomain metadata is not a string")
    void skipsNonStringSubdomain() {
        Component component = new Component("c2", "Billing", Map.of(Component.SUBDOMAIN_KEY, 7));

        SystemInfoResult result = resolver.resolve(component, EU10, CancellationToken.create());

        assertThat(result.failure()).isEqualTo(FailureKind.EXHAUSTED);
        assertThat(gateway.calls()).hasSize(2);
    }

    @Test
    @DisplayName("reports aborted and makes no calls when the token is cancelled")
    void abortedWhenCancelled() {
        SystemInfoResult result = resolver.resolve(Component.withSubdomain("c2", "Billing", "sap-x"), EU10,
                CancellationToken.cancelled());

        assertThat(result.failure()).isEqualTo(FailureKind.ABORTED);
        assertThat(result.error()).isEqualTo("Request aborted");
        assertThat(gateway.calls()).isEmpty();
    }

    @Test
    @DisplayName("rejects missing arguments")
    void rejectsMissingArguments() {
        assertThatThrownBy(() -> resolver.resolve(null, EU10, CancellationToken.create()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(Component.of("c1", "a"), null, CancellationToken.create()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
