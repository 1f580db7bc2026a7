package com.lbg.markets.surveillance.courier.transport;

import com.lbg.markets.surveillance.courier.util.Sleeper;

import java.time.Clock;
import java.time.Duration;

/**
 * Sliding-window permit source: at most {@code permits} acquisitions in any
 * {@code window}. {@link #acquire()} suspends the caller until a permit frees up.
 *
 * <p>Timestamps of recent acquisitions are kept in a circular buffer; entries
 * older than the window are expired lazily.
 */
public class QuotaPool {

    private final String name;
    private final long[] timestamps;
    private final long windowMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private int index;
    private int count;

    public QuotaPool(String name, int permits, Duration window, Clock clock, Sleeper sleeper) {
        if (permits < 1) {
            throw new IllegalArgumentException(name + " pool needs at least one permit");
        }
        if (window.toMillis() < 1) {
            throw new IllegalArgumentException(name + " pool window must be at least 1ms");
        }
        this.name = name;
        this.timestamps = new long[permits];
        this.windowMs = window.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public String name() {
        return name;
    }

    /**
     * Take a permit, waiting for one to expire out of the window if necessary.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long wait;
            synchronized (this) {
                long now = clock.millis();
                if (tryAcquire(now)) {
                    return;
                }
                wait = timeUntilAvailable(now);
            }
            sleeper.sleep(Duration.ofMillis(Math.max(1, wait)));
        }
    }

    public synchronized boolean tryAcquire() {
        return tryAcquire(clock.millis());
    }

    public synchronized int remaining() {
        expireOldEntries(clock.millis());
        return timestamps.length - count;
    }

    private boolean tryAcquire(long now) {
        expireOldEntries(now);
        if (count >= timestamps.length) {
            return false;
        }
        timestamps[index] = now;
        index = (index + 1) % timestamps.length;
        count++;
        return true;
    }

    private long timeUntilAvailable(long now) {
        if (count < timestamps.length) {
            return 0;
        }
        int oldest = (index - count + timestamps.length) % timestamps.length;
        return Math.max(0, timestamps[oldest] + windowMs - now);
    }

    private void expireOldEntries(long now) {
        long cutoff = now - windowMs;
        while (count > 0) {
            int oldest = (index - count + timestamps.length) % timestamps.length;
            if (timestamps[oldest] <= cutoff) {
                count--;
            } else {
                break;
            }
        }
    }
}
