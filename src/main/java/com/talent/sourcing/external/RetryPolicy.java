package com.talent.sourcing.external;

import java.time.Duration;

/**
 * Bounded retry with jittered exponential backoff.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay   delay before the first retry
 * @param maxDelay    cap for any single delay
 * @param jitter      fraction in [0, 1] by which a delay may be randomly shortened or lengthened
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
        }
    }

    /**
     * Default policy: 3 attempts, 1s base delay doubling up to 8s, 20% jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(8), 0.2);
    }

    /**
     * A single attempt and no retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     *
     * @param random a uniform sample in [0, 1) used for jitter
     */
    public Duration backoff(int retry, double random) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        long exponential = base << Math.min(retry - 1, 30);
        if (exponential < 0 || exponential > max) {
            exponential = max;
        }
        double factor = 1.0 + jitter * (2.0 * random - 1.0);
        long jittered = Math.round(exponential * factor);
        return Duration.ofMillis(Math.max(0, Math.min(max, jittered)));
    }
}
