package com.devportal.health;

import com.devportal.health.model.Component;
import com.devportal.health.model.Landscape;
import com.devportal.health.model.ProbeOutcome;
import com.devportal.health.model.SystemInfoResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves build/version metadata for a component by trying the known endpoint
 * conventions in order and returning the first one that answers.
 * <p>
 * Order:
 * <ol>
 *   <li>{@code /systemInformation/public}</li>
 *   <li>{@code /systemInformation/public} on the subdomain host</li>
 *   <li>{@code /version}</li>
 *   <li>{@code /version} on the subdomain host</li>
 * </ol>
 * Subdomain variants are skipped (never called) for components without a subdomain.
 * Attempts run one after another on the calling thread.
 */
public final class SystemInfoResolver {

    private static final Logger log = LoggerFactory.getLogger(SystemInfoResolver.class);

    /**
     * One endpoint convention: a path, optionally on the subdomain-qualified host.
     */
    record Variant(String path, boolean onSubdomain) {
    }

    static final List<Variant> VARIANTS = List.of(
            new Variant(EndpointResolver.SYSTEM_INFO_PATH, false),
            new Variant(EndpointResolver.SYSTEM_INFO_PATH, true),
            new Variant(EndpointResolver.VERSION_PATH, false),
            new Variant(EndpointResolver.VERSION_PATH, true)
    );

    private final ProbeExecutor probeExecutor;

    public SystemInfoResolver(ProbeExecutor probeExecutor) {
        if (probeExecutor == null) {
            throw new IllegalArgumentException("probeExecutor must not be null");
        }
        this.probeExecutor = probeExecutor;
    }

    /**
     * Resolves system information for {@code component} in {@code landscape}.
     *
     * @return the first successful variant, {@link SystemInfoResult#aborted()} if the token
     *         is cancelled, or {@link SystemInfoResult#exhausted()} when nothing answered
     */
    public SystemInfoResult resolve(Component component, Landscape landscape, CancellationToken token) {
        if (component == null) {
            throw new IllegalArgumentException("component must not be null");
        }
        if (landscape == null) {
            throw new IllegalArgumentException("landscape must not be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }

        Optional<String> subdomain = component.subdomain();
        for (Variant variant : VARIANTS) {
            if (token.isCancelled()) {
                return SystemInfoResult.aborted();
            }
            if (variant.onSubdomain() && subdomain.isEmpty()) {
                continue;
            }
            String url = variant.onSubdomain()
                    ? EndpointResolver.probeUrl(component, landscape, subdomain.get(), variant.path())
                    : EndpointResolver.probeUrl(component, landscape, variant.path());

            ProbeOutcome outcome = probeExecutor.probe(url, token).join();
            if (outcome.isSuccess()) {
                return SystemInfoResult.success(outcome.data(), url);
            }
            if (outcome.isAborted()) {
                return SystemInfoResult.aborted();
            }
            log.debug("System info variant {} failed for {}: {}", url, component.name(), outcome.error());
        }

        log.debug("No system info endpoint answered for {} in {}", component.name(), landscape.name());
        return SystemInfoResult.exhausted();
    }
}
