package org.smileyface.campuscrawler.fetch;

import java.time.Duration;

/**
 * Shape of the pause between two failed fetch attempts.
 */
public enum BackoffPolicy {

    /** attempt × unit: 2s, 4s, 6s, ... for a 2s unit. */
    LINEAR {
        @Override
        public Duration delay(int attempt, Duration unit) {
            return unit.multipliedBy(Math.max(1, attempt));
        }
    },

    /** unit × 2^(attempt-1): 2s, 4s, 8s, ... for a 2s unit. */
    EXPONENTIAL {
        @Override
        public Duration delay(int attempt, Duration unit) {
            int shift = Math.min(Math.max(0, attempt - 1), 30);
            return unit.multipliedBy(1L << shift);
        }
    };

    /**
     * @param attempt 1-based index of the attempt that just failed
     * @param unit    base delay
     * @return how long to wait before the next attempt
     */
    public abstract Duration delay(int attempt, Duration unit);
}
