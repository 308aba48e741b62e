package com.devportal.portal.api;

import com.devportal.health.CancellationToken;
import com.devportal.health.HealthApi;
import com.devportal.health.model.ComponentHealthCheck;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.health.model.SystemInfoResult;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the health engine.
 *
 * <p>Every call runs under its own {@link CancellationToken}; tokens still in flight are
 * cancelled when the service shuts down. Probe failures are part of the response body, and
 * only malformed requests produce error statuses.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthApi healthApi;
    private final Set<CancellationToken> inFlight = ConcurrentHashMap.newKeySet();

    public HealthController(HealthApi healthApi) {
        this.healthApi = healthApi;
    }

    @GetMapping("/probe")
    public ProbeOutcome probe(@RequestParam("url") String url) {
        return withToken(token -> healthApi.fetchHealthStatus(url, token));
    }

    @PostMapping("/system-info")
    public SystemInfoResult systemInfo(@Valid @RequestBody SystemInfoRequest request) {
        return withToken(token -> healthApi.fetchSystemInfo(request.component(), request.landscape(), token));
    }

    @PostMapping("/batch")
    public BatchHealthResponse batch(@Valid @RequestBody BatchHealthRequest request) {
        List<ComponentHealthCheck> checks = withToken(token -> healthApi.fetchAllHealthStatuses(
                request.components(), request.landscape(), token,
                (completed, total) -> log.debug("Batch progress {}/{}", completed, total)));
        return new BatchHealthResponse(checks, healthApi.summarize(checks));
    }

    /**
     * Cancels every call still in flight; invoked on shutdown so pending probes settle as aborted.
     */
    @PreDestroy
    public void cancelInFlight() {
        if (!inFlight.isEmpty()) {
            log.info("Cancelling {} in-flight health calls", inFlight.size());
        }
        inFlight.forEach(CancellationToken::cancel);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private <T> T withToken(Function<CancellationToken, T> call) {
        CancellationToken token = CancellationToken.create();
        inFlight.add(token);
        try {
            return call.apply(token);
        } finally {
            inFlight.remove(token);
        }
    }
}
