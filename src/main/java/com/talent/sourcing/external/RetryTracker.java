package com.talent.sourcing.external;

/**
 * State machine for a single retried call:
 * {@code PENDING -> RETRYING(n) -> SUCCEEDED | FAILED}.
 * Not thread-safe; one tracker belongs to one call.
 */
public class RetryTracker {

    private final int maxAttempts;
    private RetryState state = RetryState.PENDING;
    private int attempts;
    private Throwable lastFailure;

    public RetryTracker(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public void recordSuccess() {
        requireActive();
        attempts++;
        state = RetryState.SUCCEEDED;
    }

    /**
     * Records a failed attempt.
     *
     * @return true if another attempt is allowed (state is now {@code RETRYING}),
     *         false if the call has {@code FAILED}
     */
    public boolean recordFailure(Throwable failure, boolean retryable) {
        requireActive();
        attempts++;
        lastFailure = failure;
        if (retryable && attempts < maxAttempts) {
            state = RetryState.RETRYING;
            return true;
        }
        state = RetryState.FAILED;
        return false;
    }

    public RetryState getState() {
        return state;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Number of retries performed so far (the n of {@code RETRYING(n)}).
     */
    public int getRetries() {
        return state == RetryState.RETRYING ? attempts : Math.max(0, attempts - 1);
    }

    public Throwable getLastFailure() {
        return lastFailure;
    }

    private void requireActive() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Retry already finished in state " + state);
        }
    }
}
