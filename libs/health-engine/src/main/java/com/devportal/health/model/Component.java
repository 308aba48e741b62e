package com.devportal.health.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One independently deployable service tracked by the portal.
 *
 * @param id       stable identifier
 * @param name     service name; lower-cased to form the host part of probe URLs
 * @param metadata free-form metadata; {@code subdomain} selects the alternate naming convention
 */
public record Component(String id, String name, Map<String, Object> metadata) {

    /** Metadata key holding the alternate subdomain prefix. */
    public static final String SUBDOMAIN_KEY = "subdomain";

    public Component {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Component of(String id, String name) {
        return new Component(id, name, Map.of());
    }

    public static Component withSubdomain(String id, String name, String subdomain) {
        return new Component(id, name, Map.of(SUBDOMAIN_KEY, subdomain));
    }

    /**
     * Returns the subdomain only when the metadata value is a non-blank string.
     */
    public Optional<String> subdomain() {
        Object value = metadata.get(SUBDOMAIN_KEY);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }
}
