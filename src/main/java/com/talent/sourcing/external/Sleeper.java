package com.talent.sourcing.external;

import java.time.Duration;

/**
 * Blocking pause, injectable so tests never wait on a real clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
