package com.talent.sourcing.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenTelemetry-backed {@link TracingService}. Stage spans are {@link SpanKind#INTERNAL};
 * third-party calls are {@link SpanKind#CLIENT} spans tagged with {@code peer.service}.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String PEER_SERVICE = "peer.service";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return start(operationName, SpanKind.INTERNAL, attributes);
    }

    @Override
    public Span startExternalCallSpan(String endpoint, String operation) {
        return start("sourcing.external", SpanKind.CLIENT,
                Map.of("endpoint", endpoint, "operation", operation, PEER_SERVICE, endpoint));
    }

    private Span start(String operationName, SpanKind kind, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(kind);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static final class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;
        private final AtomicBoolean ended = new AtomicBoolean();

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            if (value != null) {
                otelSpan.setAttribute(key, value);
            }
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            otelSpan.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            otelSpan.recordException(t);
        }

        @Override
        public void fail(Throwable t) {
            otelSpan.recordException(t);
            otelSpan.setStatus(StatusCode.ERROR, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }

        @Override
        public void close() {
            if (ended.compareAndSet(false, true)) {
                otelSpan.end();
            }
        }
    }
}
