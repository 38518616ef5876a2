package com.talent.sourcing.external;

/**
 * States of one retried call. {@code SUCCEEDED} and {@code FAILED} are terminal.
 */
public enum RetryState {
    PENDING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
