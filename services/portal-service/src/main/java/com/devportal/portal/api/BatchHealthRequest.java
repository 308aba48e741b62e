package com.devportal.portal.api;

import com.devportal.health.model.Component;
import com.devportal.health.model.Landscape;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Body of {@code POST /api/v1/health/batch}.
 */
public record BatchHealthRequest(@NotNull List<Component> components, @NotNull Landscape landscape) {
}
