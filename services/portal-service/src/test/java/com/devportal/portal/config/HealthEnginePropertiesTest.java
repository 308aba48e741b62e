package com.devportal.portal.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the {@link HealthEngineProperties} compact-constructor defaults.
 */
@DisplayName("HealthEngineProperties")
class HealthEnginePropertiesTest {

    @Test
    @DisplayName("accepts explicit values")
    void acceptsExplicitValues() {
        var props = new HealthEngineProperties("http://backend", "/proxy", Duration.ofSeconds(3), 8, 50, "portal");

        assertThat(props.proxyBaseUrl()).isEqualTo("http://backend");
        assertThat(props.proxyPath()).isEqualTo("/proxy");
        assertThat(props.probeTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(props.maxConcurrency()).isEqualTo(8);
        assertThat(props.queueCapacity()).isEqualTo(50);
        assertThat(props.serviceName()).isEqualTo("portal");
    }

    @Test
    @DisplayName("defaults every optional field")
    void appliesDefaults() {
        var props = new HealthEngineProperties("http://backend", null, null, 0, 0, " ");

        assertThat(props.proxyPath()).isEqualTo("/cis-public/proxy");
        assertThat(props.probeTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.maxConcurrency()).isEqualTo(16);
        assertThat(props.queueCapacity()).isEqualTo(1000);
        assertThat(props.serviceName()).isEqualTo("portal-service");
    }

    @Test
    @DisplayName("replaces a non-positive timeout with the default")
    void replacesNonPositiveTimeout() {
        assertThat(new HealthEngineProperties("http://backend", null, Duration.ZERO, 4, 10, null).probeTimeout())
                .isEqualTo(HealthEngineProperties.DEFAULT_PROBE_TIMEOUT);
        assertThat(new HealthEngineProperties("http://backend", null, Duration.ofSeconds(-1), 4, 10, null).probeTimeout())
                .isEqualTo(HealthEngineProperties.DEFAULT_PROBE_TIMEOUT);
    }

    @Test
    @DisplayName("prefixes a relative proxy path with a slash")
    void normalizesProxyPath() {
        var props = new HealthEngineProperties("http://backend", "cis-public/proxy", null, 0, 0, null);

        assertThat(props.proxyPath()).isEqualTo("/cis-public/proxy");
    }
}
