package com.shelf.matching.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Item spans are started on worker threads and are not parented to the run
 * span; they share its {@code shelf.run_id} attribute instead. Standalone matches
 * carry no run id.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<String> RUN_ID = AttributeKey.stringKey("shelf.run_id");
    static final AttributeKey<String> ITEM_ID = AttributeKey.stringKey("shelf.item_id");
    static final AttributeKey<Long> ITEMS_TOTAL = AttributeKey.longKey("shelf.items.total");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRunSpan(String runId, int totalItems) {
        return new OTelSpanAdapter(tracer.spanBuilder(RUN_SPAN)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(RUN_ID, runId)
                .setAttribute(ITEMS_TOTAL, (long) totalItems)
                .startSpan());
    }

    @Override
    public Span startItemSpan(String runId, String itemId) {
        var builder = tracer.spanBuilder(ITEM_SPAN)
                .setSpanKind(SpanKind.INTERNAL)
                .setNoParent()
                .setAttribute(ITEM_ID, itemId);
        if (runId != null) {
            builder.setAttribute(RUN_ID, runId);
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static final class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void addEvent(String name) {
            otelSpan.addEvent(name);
        }

        @Override
        public void succeed() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}
