package com.talent.sourcing.pipeline;

import java.time.Duration;

/**
 * Thrown when a run exceeds {@link PipelineOptions#runTimeout()}.
 */
public class PipelineTimeoutException extends RuntimeException {

    private final Duration timeout;

    public PipelineTimeoutException(String runId, Duration timeout, Throwable cause) {
        super("Run " + runId + " exceeded its deadline of " + timeout.toSeconds() + "s", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
