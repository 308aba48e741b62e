package com.devportal.health.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body returned by the proxy: the upstream JSON plus {@code componentSuccess} and {@code statusCode}.
 */
public record ProxyResponse(Map<String, Object> body) {

    public static final String COMPONENT_SUCCESS = "componentSuccess";
    public static final String STATUS_CODE = "statusCode";

    public ProxyResponse {
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    /**
     * True only when the proxy explicitly reports {@code componentSuccess: false}.
     * A missing flag counts as success.
     */
    public boolean componentFailed() {
        return Boolean.FALSE.equals(body.get(COMPONENT_SUCCESS));
    }

    /**
     * Upstream HTTP status code as reported by the proxy, or null when absent.
     */
    public Object statusCode() {
        return body.get(STATUS_CODE);
    }
}
