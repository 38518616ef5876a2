package com.talent.sourcing.external;

import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs an external call under a {@link RetryPolicy}. Only {@link ExternalTransientException}
 * is retried; anything else fails the call on the first attempt.
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final MetricsService metrics;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble(), new NoOpMetricsService());
    }

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, DoubleSupplier random, MetricsService metrics) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
        this.metrics = metrics;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Executes the call, retrying transient failures.
     *
     * @param operation short name used in logs and metrics
     * @return the call's result
     * @throws ExternalTransientException when every attempt failed transiently
     * @throws ExternalPermanentException on the first permanent failure
     */
    public <T> T execute(String operation, Supplier<T> call) {
        RetryTracker tracker = new RetryTracker(policy.maxAttempts());
        while (true) {
            try {
                T result = call.get();
                tracker.recordSuccess();
                if (tracker.getAttempts() > 1) {
                    log.info("retry.succeeded operation={} attempts={}", operation, tracker.getAttempts());
                }
                return result;
            } catch (ExternalTransientException e) {
                if (!tracker.recordFailure(e, true)) {
                    log.warn("retry.exhausted operation={} attempts={} error={}",
                            operation, tracker.getAttempts(), e.getMessage());
                    throw e;
                }
                Duration delay = policy.backoff(tracker.getAttempts(), random.getAsDouble());
                metrics.recordRetry(operation);
                log.info("retry.scheduled operation={} attempt={} delayMs={} error={}",
                        operation, tracker.getAttempts(), delay.toMillis(), e.getMessage());
                pause(operation, delay, e);
            } catch (RuntimeException e) {
                tracker.recordFailure(e, false);
                throw e;
            }
        }
    }

    private void pause(String operation, Duration delay, ExternalTransientException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalTransientException(cause.getEndpoint(),
                    "Interrupted while waiting to retry " + operation, ie);
        }
    }
}
