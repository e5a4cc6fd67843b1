package com.tessera.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Supplier;

/**
 * Wraps event store operations in OpenTelemetry spans tagged with the originator id.
 *
 * <p>Only the OTel API is used here; exporters, samplers and resource attributes are configured by
 * the application that owns the SDK.
 */
public final class StoreTracing {

    /** Span attribute holding the originator id of the stream being read or written. */
    public static final String ATTR_ORIGINATOR_ID = "tessera.originator_id";

    /** Instrumentation scope name for tracers created by {@link #noop()} and callers. */
    public static final String INSTRUMENTATION_NAME = "com.tessera.eventstore";

    private final Tracer tracer;

    /**
     * Creates tracing backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public StoreTracing(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Tracing that records nothing. */
    public static StoreTracing noop() {
        return new StoreTracing(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs the work inside a new internal span. The span's status is set to ERROR and the
     * exception recorded when the work throws; the exception is rethrown unchanged.
     *
     * @param spanName name for the span, e.g. {@code "eventstore.append"}
     * @param originatorId stream the operation concerns
     * @param work the operation
     * @return the operation's result
     */
    public <T> T inSpan(String spanName, String originatorId, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        if (originatorId != null) {
            builder.setAttribute(ATTR_ORIGINATOR_ID, originatorId);
        }
        Span span = builder.startSpan();
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

    /** Void variant of {@link #inSpan(String, String, Supplier)}. */
    public void inSpan(String spanName, String originatorId, Runnable work) {
        inSpan(spanName, originatorId, () -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }
}
