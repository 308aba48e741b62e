package com.devportal.portal.api;

import com.devportal.health.model.ComponentHealthCheck;
import com.devportal.health.model.HealthSummary;
import java.util.List;

/**
 * One settled record per requested component, in request order, plus the aggregate counts.
 */
public record BatchHealthResponse(List<ComponentHealthCheck> checks, HealthSummary summary) {
}
