package com.devportal.health.model;

import java.util.Map;

/**
 * Build/version metadata lookup result. {@code data} is passed through unchanged from
 * whichever endpoint variant answered first.
 */
public record SystemInfoResult(
        ResultStatus status,
        Map<String, Object> data,
        String url,
        String error,
        FailureKind failure
) {

    public static final String EXHAUSTED_MESSAGE = "All system info endpoints failed";

    public static SystemInfoResult success(Map<String, Object> data, String url) {
        return new SystemInfoResult(ResultStatus.SUCCESS, data, url, null, null);
    }

    public static SystemInfoResult exhausted() {
        return new SystemInfoResult(ResultStatus.ERROR, null, null, EXHAUSTED_MESSAGE, FailureKind.EXHAUSTED);
    }

    public static SystemInfoResult aborted() {
        return new SystemInfoResult(ResultStatus.ERROR, null, null, ProbeOutcome.ABORTED_MESSAGE, FailureKind.ABORTED);
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
