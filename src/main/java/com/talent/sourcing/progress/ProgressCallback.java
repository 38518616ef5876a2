package com.talent.sourcing.progress;

/**
 * Per-item progress inside a stage. {@link ProgressReporter#callbackFor} turns these calls
 * into PROGRESS events.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed items finished so far, including failed ones
     * @param total     items in the stage, or -1 when unknown
     * @param message   optional detail, e.g. the entity just processed
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};

    /**
     * Returns {@code callback}, or {@link #NOOP} when it is null.
     */
    static ProgressCallback orNoop(ProgressCallback callback) {
        return callback != null ? callback : NOOP;
    }
}
