package org.smileyface.campuscrawler.service;

import java.time.Instant;

/**
 * Immutable snapshot of a crawl run.
 */
public final class CrawlReport {
    private final CrawlState state;
    private final int pagesFetched;
    private final int pagesSaved;
    private final int pagesSkipped;
    private final int fetchFailures;
    private final int writeFailures;
    private final int visitedCount;
    private final int queuedCount;
    private final String lastUrl;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CrawlReport(CrawlState state, int pagesFetched, int pagesSaved, int pagesSkipped, int fetchFailures,
                       int writeFailures, int visitedCount, int queuedCount, String lastUrl,
                       Instant startedAt, Instant finishedAt) {
        this.state = state;
        this.pagesFetched = pagesFetched;
        this.pagesSaved = pagesSaved;
        this.pagesSkipped = pagesSkipped;
        this.fetchFailures = fetchFailures;
        this.writeFailures = writeFailures;
        this.visitedCount = visitedCount;
        this.queuedCount = queuedCount;
        this.lastUrl = lastUrl;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public CrawlState getState() { return state; }
    public int getPagesFetched() { return pagesFetched; }
    public int getPagesSaved() { return pagesSaved; }
    public int getPagesSkipped() { return pagesSkipped; }
    public int getFetchFailures() { return fetchFailures; }
    public int getWriteFailures() { return writeFailures; }
    public int getVisitedCount() { return visitedCount; }
    public int getQueuedCount() { return queuedCount; }
    public String getLastUrl() { return lastUrl; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    @Override
    public String toString() {
        return "CrawlReport{" +
                "state=" + state +
                ", fetched=" + pagesFetched +
                ", saved=" + pagesSaved +
                ", skipped=" + pagesSkipped +
                ", fetchFailures=" + fetchFailures +
                ", writeFailures=" + writeFailures +
                ", visited=" + visitedCount +
                ", queued=" + queuedCount +
                '}';
    }
}
