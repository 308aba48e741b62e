package com.devportal.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for health probing, all tagged with the owning service name.
 * <p>
 * Meters are registered lazily through the registry, which deduplicates by name and
 * tags, so repeated calls for the same outcome reuse the same counter.
 */
public final class ProbeMetrics {

    /** Counter of individual probes, tagged by {@link #TAG_OUTCOME}. */
    public static final String PROBES = "devportal.health.probes";

    /** Timer of individual probe durations, tagged by {@link #TAG_OUTCOME}. */
    public static final String PROBE_DURATION = "devportal.health.probe.duration";

    /** Counter of batch invocations. */
    public static final String BATCHES = "devportal.health.batches";

    /** Distribution of batch sizes (components per batch). */
    public static final String BATCH_SIZE = "devportal.health.batch.size";

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the probe outcome. */
    public static final String TAG_OUTCOME = "outcome";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ABORTED = "aborted";
    public static final String OUTCOME_TRANSPORT = "transport";
    public static final String OUTCOME_UPSTREAM = "upstream";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as the {@code service} tag
     */
    public ProbeMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Records one settled probe.
     *
     * @param outcome    one of the {@code OUTCOME_*} constants
     * @param durationMs elapsed time of the probe in milliseconds
     */
    public void recordProbe(String outcome, long durationMs) {
        probeCounter(outcome).increment();
        Timer.builder(PROBE_DURATION)
                .description("Elapsed time of proxied health probes")
                .tags(baseTags(TAG_OUTCOME, outcome))
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, durationMs)));
    }

    /**
     * Records the start of a batch over the given number of components.
     */
    public void recordBatch(int componentCount) {
        Counter.builder(BATCHES)
                .description("Number of batch health check invocations")
                .tags(baseTags())
                .register(registry)
                .increment();
        DistributionSummary.builder(BATCH_SIZE)
                .description("Number of components per batch health check")
                .tags(baseTags())
                .register(registry)
                .record(componentCount);
    }

    /**
     * Returns the probe counter for the given outcome.
     */
    public Counter probeCounter(String outcome) {
        return Counter.builder(PROBES)
                .description("Number of proxied health probes by outcome")
                .tags(baseTags(TAG_OUTCOME, outcome))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
