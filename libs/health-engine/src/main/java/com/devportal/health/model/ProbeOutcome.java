package com.devportal.health.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one proxied HTTP attempt.
 *
 * @param status         success or error
 * @param data           parsed JSON body on success, null otherwise
 * @param error          human-readable message on error, null otherwise
 * @param failure        error classification on error, null otherwise
 * @param responseTimeMs elapsed wall-clock time of this attempt, never negative
 */
public record ProbeOutcome(
        ResultStatus status,
        Map<String, Object> data,
        String error,
        FailureKind failure,
        long responseTimeMs
) {

    /** Error message of a probe cancelled by the caller. */
    public static final String ABORTED_MESSAGE = "Request aborted";

    /** Error message when a transport failure carries no message of its own. */
    public static final String UNKNOWN_ERROR_MESSAGE = "Unknown error";

    public ProbeOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (responseTimeMs < 0) {
            responseTimeMs = 0;
        }
        if (data != null) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static ProbeOutcome success(Map<String, Object> data, long responseTimeMs) {
        return new ProbeOutcome(ResultStatus.SUCCESS, data == null ? Map.of() : data, null, null, responseTimeMs);
    }

    public static ProbeOutcome aborted(long responseTimeMs) {
        return new ProbeOutcome(ResultStatus.ERROR, null, ABORTED_MESSAGE, FailureKind.ABORTED, responseTimeMs);
    }

    public static ProbeOutcome transportError(String message, long responseTimeMs) {
        String error = message == null || message.isBlank() ? UNKNOWN_ERROR_MESSAGE : message;
        return new ProbeOutcome(ResultStatus.ERROR, null, error, FailureKind.TRANSPORT, responseTimeMs);
    }

    public static ProbeOutcome upstreamError(Object statusCode, long responseTimeMs) {
        return new ProbeOutcome(ResultStatus.ERROR, null,
                "Component returned status " + statusCode, FailureKind.UPSTREAM, responseTimeMs);
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    public boolean isAborted() {
        return failure == FailureKind.ABORTED;
    }
}
