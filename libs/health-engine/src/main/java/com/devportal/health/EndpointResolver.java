package com.devportal.health;

import com.devportal.health.model.Component;
import com.devportal.health.model.Landscape;

import java.util.Locale;

/**
 * Builds component probe URLs for the Cloud Foundry naming conventions in use:
 * <pre>
 * https://{component}.cfapps.{route}{path}
 * https://{subdomain}.{component}.cfapps.{route}{path}
 * </pre>
 * The component name is lower-cased; everything else is used as given.
 */
public final class EndpointResolver {

    /** Liveness endpoint. */
    public static final String HEALTH_PATH = "/health";

    /** Current build metadata endpoint. */
    public static final String SYSTEM_INFO_PATH = "/systemInformation/public";

    /** Legacy build metadata endpoint. */
    public static final String VERSION_PATH = "/version";

    private EndpointResolver() {
        // utility class
    }

    public static String probeUrl(Component component, Landscape landscape, String path) {
        requireArguments(component, landscape, path);
        return "https://" + host(component) + ".cfapps." + landscape.route() + path;
    }

    public static String probeUrl(Component component, Landscape landscape, String subdomain, String path) {
        requireArguments(component, landscape, path);
        if (subdomain == null || subdomain.isBlank()) {
            throw new IllegalArgumentException("subdomain must not be null or blank");
        }
        return "https://" + subdomain + "." + host(component) + ".cfapps." + landscape.route() + path;
    }

    public static String healthUrl(Component component, Landscape landscape) {
        return probeUrl(component, landscape, HEALTH_PATH);
    }

    public static String healthUrl(Component component, Landscape landscape, String subdomain) {
        return probeUrl(component, landscape, subdomain, HEALTH_PATH);
    }

    private static String host(Component component) {
        return component.name().toLowerCase(Locale.ROOT);
    }

    private static void requireArguments(Component component, Landscape landscape, String path) {
        if (component == null) {
            throw new IllegalArgumentException("component must not be null");
        }
        if (landscape == null) {
            throw new IllegalArgumentException("landscape must not be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
    }
}
