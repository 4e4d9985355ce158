package com.planner.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the
 * correlation, tenant and scope ids of the current {@link CorrelationContextHolder}.
 * <p>
 * Does not configure the SDK; the application supplies the tracer.
 */
public final class SpanHelper {

    /** Span attribute carrying the correlation id. */
    public static final String ATTR_CORRELATION_ID = "correlation.id";

    /** Span attribute carrying the tenant id. */
    public static final String ATTR_TENANT_ID = "tenant.id";

    /** Span attribute carrying the request scope id. */
    public static final String ATTR_SCOPE_ID = "scope.id";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside an internal span.
     *
     * @param spanName name for the span
     * @param work     the work to execute
     * @param <T>      return type
     * @return the result of the work
     */
    public <T> T withSpan(String spanName, Supplier<T> work) {
        return withSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span of the given kind with extra attributes. The span is
     * marked as failed and the exception recorded when {@code work} throws.
     *
     * @param spanName   name for the span
     * @param kind       span kind
     * @param attributes additional span attributes
     * @param work       the work to execute
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                          Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.scopeId() != null) {
                span.setAttribute(ATTR_SCOPE_ID, ctx.scopeId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException | Error e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #withSpan(String, Supplier)}.
     */
    public void run(String spanName, Runnable work) {
        withSpan(spanName, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
