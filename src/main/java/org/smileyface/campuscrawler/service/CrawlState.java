package org.smileyface.campuscrawler.service;

/**
 * Lifecycle of one crawl run.
 */
public enum CrawlState {
    NEW,
    RUNNING,
    /** The queue drained before the page budget was used up. */
    COMPLETED,
    /** The configured number of successful fetches was reached. */
    BUDGET_EXHAUSTED,
    INTERRUPTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == BUDGET_EXHAUSTED || this == INTERRUPTED;
    }
}
