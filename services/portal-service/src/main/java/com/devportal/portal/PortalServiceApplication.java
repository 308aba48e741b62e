package com.devportal.portal;

import com.devportal.portal.config.HealthEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Health and system information gateway of the developer portal.
 *
 * <p>Component probes never leave this service directly: every health and system info
 * request is relayed through the portal backend's proxy at
 * {@code devportal.health.proxy-base-url}, on a probe pool bounded by
 * {@code devportal.health.max-concurrency}. The startup log names that proxy and pool so a
 * misrouted deployment is visible before the first batch runs.
 */
@SpringBootApplication
@EnableConfigurationProperties(HealthEngineProperties.class)
public class PortalServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(PortalServiceApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(PortalServiceApplication.class, args);
        log.info(startupSummary(context.getBean(HealthEngineProperties.class)));
    }

    static String startupSummary(HealthEngineProperties properties) {
        return "Portal service " + properties.serviceName()
                + " probing through " + properties.proxyBaseUrl() + properties.proxyPath()
                + " (timeout " + properties.probeTimeout().toMillis() + "ms, "
                + properties.maxConcurrency() + " workers)";
    }
}
