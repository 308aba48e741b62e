package com.devportal.observability;

/**
 * Immutable logging context for one unit of health-probing work.
 * <p>
 * A batch run establishes a {@code ProbeContext} per component so that every log line
 * emitted while probing that component (on whichever pool thread it runs) carries the
 * batch, landscape and component identifiers in the SLF4J MDC.
 *
 * @param batchId     unique ID of the batch invocation (one per orchestrator call)
 * @param landscape   landscape name the batch targets (nullable for ad-hoc probes)
 * @param componentId component being probed (nullable for batch-level log lines)
 */
public record ProbeContext(String batchId, String landscape, String componentId) {

    /** MDC key for the batch ID. */
    public static final String MDC_BATCH_ID = "batchId";

    /** MDC key for the landscape name. */
    public static final String MDC_LANDSCAPE = "landscape";

    /** MDC key for the component ID. */
    public static final String MDC_COMPONENT_ID = "componentId";

    public ProbeContext {
        if (batchId == null || batchId.isBlank()) {
            throw new IllegalArgumentException("batchId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context scoped to a single component.
     */
    public ProbeContext forComponent(String componentId) {
        return new ProbeContext(batchId, landscape, componentId);
    }
}
