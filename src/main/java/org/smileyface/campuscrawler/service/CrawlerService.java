package org.smileyface.campuscrawler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.campuscrawler.crawler.CrawlerProperties;
import org.smileyface.campuscrawler.crawler.Frontier;
import org.smileyface.campuscrawler.crawler.LinkDiscoverer;
import org.smileyface.campuscrawler.crawler.UrlNormalizer;
import org.smileyface.campuscrawler.extractor.ContentExtractor;
import org.smileyface.campuscrawler.fetch.PageFetcher;
import org.smileyface.campuscrawler.fetch.RateLimiter;
import org.smileyface.campuscrawler.model.ExtractedPage;
import org.smileyface.campuscrawler.model.FrontierState;
import org.smileyface.campuscrawler.model.PageFetchResult;
import org.smileyface.campuscrawler.model.PageOutcome;
import org.smileyface.campuscrawler.persist.StatePersister;
import org.smileyface.campuscrawler.writer.DocumentWriter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import static org.smileyface.campuscrawler.util.CrawlerUtils.durationMs;

/**
 * Drives a crawl: seeds the frontier (optionally from a checkpoint), then fetches queued pages in
 * FIFO order until the page budget is used up or the queue drains. Each fetched page is cleaned,
 * written to the corpus and mined for new links. Only successful fetches count against the budget.
 * The frontier is checkpointed after every {@code checkpointInterval} successful fetches and once
 * more when the loop ends, whatever the reason.
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    private final CrawlerProperties properties;
    private final UrlNormalizer normalizer;
    private final LinkDiscoverer linkDiscoverer;
    private final ContentExtractor contentExtractor;
    private final PageFetcher pageFetcher;
    private final RateLimiter rateLimiter;
    private final DocumentWriter documentWriter;
    private final StatePersister statePersister;

    private final AtomicInteger fetched = new AtomicInteger();
    private final AtomicInteger saved = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger fetchFailures = new AtomicInteger();
    private final AtomicInteger writeFailures = new AtomicInteger();

    private volatile CrawlState state = CrawlState.NEW;
    private volatile Frontier frontier;
    private volatile int maxPages;
    private volatile String lastUrl;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public CrawlerService(CrawlerProperties properties,
                          UrlNormalizer normalizer,
                          LinkDiscoverer linkDiscoverer,
                          ContentExtractor contentExtractor,
                          PageFetcher pageFetcher,
                          RateLimiter rateLimiter,
                          DocumentWriter documentWriter,
                          StatePersister statePersister) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.linkDiscoverer = Objects.requireNonNull(linkDiscoverer, "linkDiscoverer");
        this.contentExtractor = Objects.requireNonNull(contentExtractor, "contentExtractor");
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.statePersister = Objects.requireNonNull(statePersister, "statePersister");
    }

    /**
     * Runs a crawl on the calling thread and blocks until it ends.
     *
     * @param maxPages maximum number of successful fetches, must be positive
     * @param resume   continue from the stored checkpoint instead of starting fresh
     * @return the final report; an interrupted crawl reports {@link CrawlState#INTERRUPTED} and leaves
     * the thread's interrupt flag set
     */
    public synchronized CrawlReport crawl(int maxPages, boolean resume) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
        }
        reset(maxPages);

        Frontier current = new Frontier(normalizer);
        if (resume) {
            FrontierState checkpoint = statePersister.load();
            current.restore(checkpoint);
            log.info("Resuming crawl: {} visited, {} queued", current.visitedCount(), current.queueSize());
        }
        int seeded = current.seed(properties.getSeedPaths(), properties.getRootUrl());
        log.debug("Seeded {} new URLs, queue size {}", seeded, current.queueSize());
        this.frontier = current;

        transitionTo(CrawlState.RUNNING);
        CrawlState end = runLoop(current);
        checkpoint(current);
        transitionTo(end);
        return getReport();
    }

    private CrawlState runLoop(Frontier current) {
        int interval = Math.max(1, properties.getCheckpointInterval());
        String inFlight = null;
        try {
            for (;;) {
                if (fetched.get() >= maxPages) {
                    return CrawlState.BUDGET_EXHAUSTED;
                }
                String url = current.deQueue();
                if (url == null) {
                    return CrawlState.COMPLETED;
                }
                if (current.isVisited(url)) {
                    continue;
                }
                inFlight = url;
                lastUrl = url;
                log.info("[{}/{}] Crawling: {}", fetched.get() + 1, maxPages, url);

                PageOutcome outcome = processUrl(current, url);
                current.markVisited(url);
                inFlight = null;
                record(outcome);

                if (outcome.isFetched() && fetched.get() % interval == 0) {
                    checkpoint(current);
                }
                rateLimiter.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (inFlight != null && !current.isVisited(inFlight)) {
                current.requeueFirst(inFlight);
            }
            return CrawlState.INTERRUPTED;
        }
    }

    private PageOutcome processUrl(Frontier current, String url) throws InterruptedException {
        PageFetchResult result = pageFetcher.fetch(url);
        if (!result.success()) {
            log.warn("Failed to fetch {} after {} attempts", url, result.attempts());
            return PageOutcome.FETCH_FAILED;
        }
        // Budget is spent as soon as the page is retrieved
        fetched.incrementAndGet();

        String markup = result.rawMarkup();
        ExtractedPage page = contentExtractor.extract(markup);
        PageOutcome outcome;
        try {
            outcome = documentWriter.write(url, page.title(), page.cleanedText())
                    ? PageOutcome.SAVED
                    : PageOutcome.SKIPPED_SHORT;
        } catch (IOException e) {
            log.error("Failed to write document for {}: {}", url, e.getMessage(), e);
            outcome = PageOutcome.WRITE_FAILED;
        }

        List<String> links = linkDiscoverer.discover(markup, url);
        int added = current.enqueueAll(links);
        log.debug("{}: {} links found, {} new", url, links.size(), added);
        return outcome;
    }

    private void record(PageOutcome outcome) {
        switch (outcome) {
            case SAVED -> saved.incrementAndGet();
            case SKIPPED_SHORT -> skipped.incrementAndGet();
            case FETCH_FAILED -> fetchFailures.incrementAndGet();
            case WRITE_FAILED -> writeFailures.incrementAndGet();
        }
    }

    private void checkpoint(Frontier current) {
        FrontierState snapshot = current.snapshot();
        try {
            statePersister.save(snapshot);
            log.info("Checkpoint saved (visited={}, queued={})", snapshot.visited().size(), snapshot.queue().size());
        } catch (IOException e) {
            log.error("Failed to save checkpoint (visited={}, queued={}): {}",
                    snapshot.visited().size(), snapshot.queue().size(), e.getMessage(), e);
        }
    }

    public CrawlState getState() {
        return state;
    }

    public CrawlReport getReport() {
        Frontier f = frontier;
        return new CrawlReport(state, fetched.get(), saved.get(), skipped.get(), fetchFailures.get(),
                writeFailures.get(), f == null ? 0 : f.visitedCount(), f == null ? 0 : f.queueSize(),
                lastUrl, startedAt, finishedAt);
    }

    private void reset(int maxPages) {
        this.maxPages = maxPages;
        fetched.set(0);
        saved.set(0);
        skipped.set(0);
        fetchFailures.set(0);
        writeFailures.set(0);
        lastUrl = null;
        startedAt = null;
        finishedAt = null;
        frontier = null;
        state = CrawlState.NEW;
    }

    /**
     * Centralized state transition with structured logging. Terminal states carry the duration and
     * the counters of the run.
     */
    private void transitionTo(CrawlState newState) {
        CrawlState old = this.state;
        if (newState == CrawlState.RUNNING) {
            this.startedAt = Instant.now();
            this.state = newState;
            log.info("Crawl state {} -> {} (maxPages={}, queued={})", old, newState, maxPages, frontier.queueSize());
            return;
        }
        if (newState.isTerminal()) {
            this.finishedAt = Instant.now();
            this.state = newState;
            long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
            switch (newState) {
                case COMPLETED -> log.info("Crawl state {} -> COMPLETED after {} ms, queue drained ({})", old, dur, getReport());
                case BUDGET_EXHAUSTED -> log.info("Crawl state {} -> BUDGET_EXHAUSTED after {} ms ({})", old, dur, getReport());
                case INTERRUPTED -> log.warn("Crawl state {} -> INTERRUPTED after {} ms (lastUrl={}, {})", old, dur, lastUrl, getReport());
                default -> {}
            }
            return;
        }
        this.state = newState;
        log.info("Crawl state {} -> {}", old, newState);
    }
}
