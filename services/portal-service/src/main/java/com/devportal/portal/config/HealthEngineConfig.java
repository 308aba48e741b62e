package com.devportal.portal.config;

import com.devportal.health.HealthApi;
import com.devportal.health.gateway.ProxyGateway;
import com.devportal.observability.ProbeMetrics;
import com.devportal.observability.ProbeTracing;
import com.devportal.portal.infrastructure.proxy.HttpProxyGateway;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Wires the health engine to the HTTP proxy and the service's meter registry.
 *
 * <p>Proxy calls run on a dedicated {@link ThreadPoolTaskExecutor} sized by
 * {@code devportal.health.max-concurrency}. On shutdown the pool lets running probes finish
 * for up to one probe timeout.
 */
@Configuration
public class HealthEngineConfig {

    static final String INSTRUMENTATION_SCOPE = "com.devportal.health";
    static final String PROBE_THREAD_PREFIX = "health-probe-";

    @Bean
    public ThreadPoolTaskExecutor probeTaskExecutor(HealthEngineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.maxConcurrency());
        executor.setMaxPoolSize(properties.maxConcurrency());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix(PROBE_THREAD_PREFIX);
        executor.setDaemon(true);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds(properties.probeTimeout()));
        return executor;
    }

    @Bean
    public ProxyGateway proxyGateway(RestClient.Builder restClientBuilder, HealthEngineProperties properties) {
        int timeoutMillis = timeoutMillis(properties.probeTimeout());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return new HttpProxyGateway(restClientBuilder.requestFactory(requestFactory),
                properties.proxyBaseUrl(), properties.proxyPath());
    }

    @Bean
    public ProbeMetrics probeMetrics(MeterRegistry meterRegistry, HealthEngineProperties properties) {
        return new ProbeMetrics(meterRegistry, properties.serviceName());
    }

    @Bean
    public ProbeTracing probeTracing() {
        return new ProbeTracing(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public HealthApi healthApi(ProxyGateway proxyGateway, ThreadPoolTaskExecutor probeTaskExecutor,
                               HealthEngineProperties properties, ProbeMetrics probeMetrics,
                               ProbeTracing probeTracing) {
        return HealthApi.create(proxyGateway, probeTaskExecutor, properties.probeTimeout(),
                probeMetrics, probeTracing, Clock.systemUTC());
    }

    /**
     * HTTP client timeouts are int milliseconds.
     *
     * @throws IllegalArgumentException if {@code timeout} does not fit
     */
    static int timeoutMillis(Duration timeout) {
        try {
            return Math.toIntExact(timeout.toMillis());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    "probeTimeout must not exceed " + Integer.MAX_VALUE + "ms, was " + timeout, e);
        }
    }

    static int awaitTerminationSeconds(Duration timeout) {
        return Math.toIntExact(Math.min(Integer.MAX_VALUE, timeout.toSeconds() + 1));
    }
}
