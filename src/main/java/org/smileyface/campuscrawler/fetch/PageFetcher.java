package org.smileyface.campuscrawler.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.model.PageFetchResult;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches a page with a bounded number of attempts. Every failure mode of a single attempt
 * (transport error, timeout, non-2xx status, unexpected runtime failure) is retried the same way;
 * between attempts the fetcher backs off according to its {@link BackoffPolicy}. No pause follows
 * the last attempt. Exhausting all attempts is reported as a failed {@link PageFetchResult}, never
 * as an exception.
 */
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PageLoader loader;
    private final Sleeper sleeper;
    private final int maxAttempts;
    private final BackoffPolicy backoffPolicy;
    private final Duration backoffUnit;
    private final int timeoutMs;

    public PageFetcher(PageLoader loader,
                       Sleeper sleeper,
                       int maxAttempts,
                       BackoffPolicy backoffPolicy,
                       Duration backoffUnit,
                       int timeoutMs) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffPolicy = backoffPolicy == null ? BackoffPolicy.LINEAR : backoffPolicy;
        this.backoffUnit = backoffUnit == null || backoffUnit.isNegative() ? Duration.ZERO : backoffUnit;
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public PageFetchResult fetch(String url) throws InterruptedException {
        return fetch(url, timeoutMs, maxAttempts);
    }

    /**
     * @param url       absolute URL
     * @param timeoutMs per-attempt timeout in milliseconds
     * @param attempts  maximum number of attempts, at least one is always made
     * @return the fetched markup or a failure after the last attempt
     * @throws InterruptedException if interrupted while backing off
     */
    public PageFetchResult fetch(String url, int timeoutMs, int attempts) throws InterruptedException {
        int max = Math.max(1, attempts);
        for (int attempt = 1; attempt <= max; attempt++) {
            try {
                String markup = loader.load(url, timeoutMs);
                if (attempt > 1) {
                    log.info("Fetched {} on attempt {}/{}", url, attempt, max);
                }
                return PageFetchResult.success(url, markup, attempt);
            } catch (IOException | RuntimeException e) {
                log.warn("Attempt {}/{} failed for {}: {}", attempt, max, url, e.getMessage());
            }
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while fetching " + url);
            }
            if (attempt < max) {
                Duration delay = backoffPolicy.delay(attempt, backoffUnit);
                log.debug("Backing off {} ms before retrying {}", delay.toMillis(), url);
                sleeper.sleep(delay);
            }
        }
        log.error("Giving up on {} after {} attempts", url, max);
        return PageFetchResult.failure(url, max);
    }
}
