package com.devportal.portal.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the health engine.
 *
 * <p>Bound from the {@code devportal.health.*} prefix and validated at startup:
 *
 * <pre>
 * devportal:
 *   health:
 *     proxy-base-url: https://portal-backend.internal
 *     proxy-path: /cis-public/proxy
 *     probe-timeout: 10s
 *     max-concurrency: 16
 *     queue-capacity: 1000
 *     service-name: portal-service
 * </pre>
 *
 * @param proxyBaseUrl   base URL of the portal backend hosting the proxy. Required.
 * @param proxyPath      path of the proxy endpoint on the backend.
 * @param probeTimeout   upper bound on a single probe.
 * @param maxConcurrency size of the pool running proxy calls.
 * @param queueCapacity  probes allowed to wait for a free worker; beyond that the
 *                       submitting thread runs the call itself.
 * @param serviceName    value of the {@code service} tag on probe metrics.
 */
@ConfigurationProperties(prefix = "devportal.health")
@Validated
public record HealthEngineProperties(
        @NotBlank String proxyBaseUrl,
        String proxyPath,
        Duration probeTimeout,
        int maxConcurrency,
        int queueCapacity,
        String serviceName) {

    public static final String DEFAULT_PROXY_PATH = "/cis-public/proxy";
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_CONCURRENCY = 16;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final String DEFAULT_SERVICE_NAME = "portal-service";

    /**
     * Applies defaults for optional fields. Runs before Bean Validation.
     */
    public HealthEngineProperties {
        if (proxyPath == null || proxyPath.isBlank()) {
            proxyPath = DEFAULT_PROXY_PATH;
        } else if (!proxyPath.startsWith("/")) {
            proxyPath = "/" + proxyPath;
        }
        if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
            probeTimeout = DEFAULT_PROBE_TIMEOUT;
        }
        if (maxConcurrency <= 0) {
            maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        }
        if (queueCapacity <= 0) {
            queueCapacity = DEFAULT_QUEUE_CAPACITY;
        }
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
    }
}
