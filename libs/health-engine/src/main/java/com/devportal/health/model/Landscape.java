package com.devportal.health.model;

/**
 * One deployment environment a component may run in.
 *
 * @param name  display name (e.g. "eu10")
 * @param route DNS suffix appended when building component URLs (e.g. "sap.hana.ondemand.com")
 */
public record Landscape(String name, String route) {

    public Landscape {
        if (route == null || route.isBlank()) {
            throw new IllegalArgumentException("route must not be null or blank");
        }
    }
}
