package com.devportal.portal.api;

import com.devportal.health.model.Component;
import com.devportal.health.model.Landscape;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/v1/health/system-info}.
 */
public record SystemInfoRequest(@NotNull Component component, @NotNull Landscape landscape) {
}
