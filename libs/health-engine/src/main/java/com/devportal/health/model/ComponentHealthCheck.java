package com.devportal.health.model;

import java.time.Instant;
import java.util.Map;

/**
 * Batch-level health record for one component in one landscape.
 * <p>
 * Starts as {@link #STATUS_LOADING} and is replaced by a settled copy once the
 * component's probes complete. {@code healthUrl} always names the URL that produced
 * the settled status.
 *
 * @param componentId    component identifier
 * @param componentName  component name as supplied by the caller
 * @param landscape      landscape name
 * @param healthUrl      URL that produced the status
 * @param status         LOADING, the upstream {@code status} value (UP, DOWN, ...), UNKNOWN or ERROR
 * @param response       raw upstream body on success
 * @param responseTimeMs response time of the attempt that settled the record
 * @param error          error message when status is ERROR
 * @param failure        error classification when status is ERROR
 * @param lastChecked    settlement timestamp, null while loading
 */
public record ComponentHealthCheck(
        String componentId,
        String componentName,
        String landscape,
        String healthUrl,
        String status,
        Map<String, Object> response,
        Long responseTimeMs,
        String error,
        FailureKind failure,
        Instant lastChecked
) {

    public static final String STATUS_LOADING = "LOADING";
    public static final String STATUS_ERROR = "ERROR";
    public static final String STATUS_UNKNOWN = "UNKNOWN";

    /** Body field the upstream health endpoint reports its status in. */
    public static final String BODY_STATUS_FIELD = "status";

    public static ComponentHealthCheck loading(Component component, Landscape landscape, String healthUrl) {
        return new ComponentHealthCheck(component.id(), component.name(), landscape.name(), healthUrl,
                STATUS_LOADING, null, null, null, null, null);
    }

    /**
     * Settles this record from a successful probe of {@code url}.
     */
    public ComponentHealthCheck succeeded(String url, ProbeOutcome outcome, Instant checkedAt) {
        return new ComponentHealthCheck(componentId, componentName, landscape, url,
                statusOf(outcome.data()), outcome.data(), outcome.responseTimeMs(), null, null, checkedAt);
    }

    /**
     * Settles this record as ERROR from the last failed probe.
     */
    public ComponentHealthCheck failed(ProbeOutcome outcome, Instant checkedAt) {
        return new ComponentHealthCheck(componentId, componentName, landscape, healthUrl,
                STATUS_ERROR, null, outcome.responseTimeMs(), outcome.error(), outcome.failure(), checkedAt);
    }

    /**
     * Settles this record as ERROR after an unexpected exception; no response time is known.
     */
    public ComponentHealthCheck isolationFailure(String message, Instant checkedAt) {
        String error = message == null || message.isBlank() ? ProbeOutcome.UNKNOWN_ERROR_MESSAGE : message;
        return new ComponentHealthCheck(componentId, componentName, landscape, healthUrl,
                STATUS_ERROR, null, null, error, FailureKind.ISOLATION, checkedAt);
    }

    public boolean isAborted() {
        return failure == FailureKind.ABORTED;
    }

    private static String statusOf(Map<String, Object> body) {
        if (body != null && body.get(BODY_STATUS_FIELD) instanceof String s && !s.isBlank()) {
            return s;
        }
        return STATUS_UNKNOWN;
    }
}
