package com.plaetzchen.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs a unit of work inside an OpenTelemetry span tagged with the current correlation context.
 * <p>
 * Only the API is used here. Without a configured SDK the global tracer is a no-op, so
 * services can call this unconditionally.
 */
public final class SpanHelper {

    static final String ATTR_CORRELATION_ID = "correlation.id";
    static final String ATTR_USER_ID = "user.id";
    static final String ATTR_REQUEST_ID = "request.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in an internal span and returns its result.
     * A runtime exception marks the span as failed and is rethrown unchanged.
     */
    public <T> T traced(String spanName, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();
        CorrelationContextHolder.get().ifPresent(ctx -> tag(span, ctx));

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #traced(String, Map, Supplier)}. */
    public void traced(String spanName, Map<String, String> attributes, Runnable work) {
        traced(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }

    private static void tag(Span span, CorrelationContext ctx) {
        span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
        if (ctx.userId() != null) {
            span.setAttribute(ATTR_USER_ID, ctx.userId());
        }
        if (ctx.requestId() != null) {
            span.setAttribute(ATTR_REQUEST_ID, ctx.requestId());
        }
    }
}
