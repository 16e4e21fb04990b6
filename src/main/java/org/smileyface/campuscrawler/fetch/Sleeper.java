package org.smileyface.campuscrawler.fetch;

import java.time.Duration;

/**
 * Suspends the calling thread. Every pause the crawler makes (retry backoff, politeness delay) goes
 * through a Sleeper so it can be observed in tests without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long ms = duration == null ? 0L : duration.toMillis();
        if (ms > 0) {
            Thread.sleep(ms);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
