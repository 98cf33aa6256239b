package com.devgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Opens OpenTelemetry spans around entity executions, tagged with the request's correlation id
 * and caller.
 * <p>
 * Spans are only exported when an SDK is installed; with the default global instance every
 * span is a no-op.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "devgate.correlation_id";
    public static final String ATTR_TENANT_ID = "devgate.tenant_id";
    public static final String ATTR_USER_ID = "enduser.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new span. A thrown exception is recorded on the span and
     * rethrown unchanged.
     */
    public <T> T withSpan(String spanName, Map<String, String> attributes, Callable<T> work) throws Exception {
        Span span = start(spanName, attributes);
        try (Scope ignored = span.makeCurrent()) {
            T result = work.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            fail(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * A runnable that opens its span when it runs, not when it is created. Use it for work
     * handed to another thread, after the correlation context has been re-bound there.
     */
    public Runnable traced(String spanName, Map<String, String> attributes, Runnable task) {
        return () -> {
            Span span = start(spanName, attributes);
            try (Scope ignored = span.makeCurrent()) {
                task.run();
                span.setStatus(StatusCode.OK);
            } catch (RuntimeException | Error e) {
                fail(span, e);
                throw e;
            } finally {
                span.end();
            }
        };
    }

    /** Adds an attribute to whichever span is current on this thread. */
    public static void annotateCurrent(String key, String value) {
        Span.current().setAttribute(key, value);
    }

    private Span start(String spanName, Map<String, String> attributes) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        CorrelationContextHolder.get().ifPresent(ctx -> {
            builder.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.userId() != null) {
                builder.setAttribute(ATTR_USER_ID, ctx.userId());
            }
            if (ctx.tenantId() != null) {
                builder.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
        });
        return builder.startSpan();
    }

    private static void fail(Span span, Throwable error) {
        span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        span.recordException(error);
    }
}
