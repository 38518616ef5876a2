package com.talent.sourcing.tracing;

import java.util.Map;

/**
 * Used when tracing is disabled. Every call returns {@link Span#NOOP} without building
 * attribute maps.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return Span.NOOP;
    }

    @Override
    public Span startStageSpan(String stage, String runId) {
        return Span.NOOP;
    }

    @Override
    public Span startExternalCallSpan(String endpoint, String operation) {
        return Span.NOOP;
    }
}
