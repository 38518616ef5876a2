package com.talent.sourcing.external;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enforces a minimum interval between consecutive calls to the same endpoint.
 * Callers of one endpoint are serialized; different endpoints never wait on each other.
 */
public class EndpointThrottle {
    private static final Logger log = LoggerFactory.getLogger(EndpointThrottle.class);

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public EndpointThrottle(Duration minInterval) {
        this(minInterval, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public EndpointThrottle(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0");
        }
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    /**
     * Blocks until a call to {@code endpoint} is allowed, then records the call time.
     *
     * @return how long the caller waited
     * @throws ExternalTransientException if interrupted while waiting
     */
    public Duration acquire(String endpoint) {
        Slot slot = slots.computeIfAbsent(endpoint, k -> new Slot());
        synchronized (slot) {
            Duration waited = Duration.ZERO;
            if (slot.lastCall != null) {
                Duration elapsed = Duration.between(slot.lastCall, clock.instant());
                Duration remaining = minInterval.minus(elapsed);
                if (!remaining.isNegative() && !remaining.isZero()) {
                    log.debug("throttle.wait endpoint={} waitMs={}", endpoint, remaining.toMillis());
                    try {
                        sleeper.sleep(remaining);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ExternalTransientException(endpoint, "Interrupted while throttled", e);
                    }
                    waited = remaining;
                }
            }
            slot.lastCall = clock.instant();
            return waited;
        }
    }

    private static final class Slot {
        private Instant lastCall;
    }
}
