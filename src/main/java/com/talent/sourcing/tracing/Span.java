package com.talent.sourcing.tracing;

/**
 * A unit of work in a distributed trace, closed with try-with-resources.
 *
 * <pre>
 * try (Span span = tracing.startStageSpan("DISCOVERY", runId)) {
 *     span.setAttribute("candidates", 42L);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    /**
     * Inert span shared by every untraced call.
     */
    Span NOOP = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the span as failed and records the cause.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    /**
     * Ends the span. Ending an already ended span has no effect.
     */
    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
