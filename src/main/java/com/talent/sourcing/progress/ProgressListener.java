package com.talent.sourcing.progress;

/**
 * Push channel for run status events. Invoked synchronously, in sequence order.
 */
@FunctionalInterface
public interface ProgressListener {

    void onEvent(ProgressEvent event);

    ProgressListener NOOP = event -> {};
}
