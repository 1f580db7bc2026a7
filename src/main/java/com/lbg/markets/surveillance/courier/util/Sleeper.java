package com.lbg.markets.surveillance.courier.util;

import java.time.Duration;

/**
 * Suspends the calling worker. Quota waits and retry backoff go through this
 * so tests can run them on a fake clock.
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
