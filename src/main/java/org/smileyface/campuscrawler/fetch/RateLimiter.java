package org.smileyface.campuscrawler.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Enforces the politeness interval: one fixed pause after every fetch, successful or not, for the
 * whole crawl.
 */
public class RateLimiter {

    private final Sleeper sleeper;
    private final Duration interval;

    public RateLimiter(Sleeper sleeper, Duration interval) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.interval = interval == null || interval.isNegative() ? Duration.ZERO : interval;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * Blocks the calling thread for the politeness interval.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public void await() throws InterruptedException {
        if (!interval.isZero()) {
            sleeper.sleep(interval);
        }
    }
}
