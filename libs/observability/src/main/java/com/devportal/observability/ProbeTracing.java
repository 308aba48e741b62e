package com.devportal.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for outbound probe calls.
 * <p>
 * Every probe span is a {@link SpanKind#CLIENT} span carrying the target URL and the
 * current {@link ProbeContext}. SDK configuration (exporter, sampler) is left to the
 * hosting service; with no SDK installed the tracer is a no-op.
 */
public final class ProbeTracing {

    /** Span name used for proxied probe calls. */
    public static final String PROBE_SPAN = "health.probe";

    public static final String ATTR_URL = "probe.url";
    public static final String ATTR_BATCH_ID = "probe.batch_id";
    public static final String ATTR_LANDSCAPE = "probe.landscape";
    public static final String ATTR_COMPONENT_ID = "probe.component_id";

    private final Tracer tracer;

    public ProbeTracing(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs the call inside a {@value #PROBE_SPAN} span for the given target URL.
     * Exceptions are recorded on the span and rethrown unchanged.
     */
    public <T> T traceProbe(String url, Callable<T> call) throws Exception {
        Span span = tracer.spanBuilder(PROBE_SPAN)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(ATTR_URL, url)
                .startSpan();

        ProbeContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_BATCH_ID, ctx.batchId());
            if (ctx.landscape() != null) {
                span.setAttribute(ATTR_LANDSCAPE, ctx.landscape());
            }
            if (ctx.componentId() != null) {
                span.setAttribute(ATTR_COMPONENT_ID, ctx.componentId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = call.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
