package com.talent.sourcing.tracing;

import java.util.Map;

/**
 * Tracing seam for the pipeline. {@link NoOpTracingService} is used when nothing is wired in.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    /**
     * Span covering one pipeline stage of a run.
     */
    default Span startStageSpan(String stage, String runId) {
        return startSpan("sourcing.stage", Map.of("stage", stage, "runId", runId));
    }

    /**
     * Span covering one third-party call.
     */
    default Span startExternalCallSpan(String endpoint, String operation) {
        return startSpan("sourcing.external", Map.of("endpoint", endpoint, "operation", operation));
    }
}
