package com.talent.sourcing.progress;

/**
 * Thrown at the next checkpoint after a run was cancelled.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String reason) {
        super("Run cancelled: " + reason);
    }
}
