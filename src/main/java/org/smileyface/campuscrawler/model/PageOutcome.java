package org.smileyface.campuscrawler.model;

/**
 * Terminal outcome of processing a single URL during a crawl. Whatever the outcome, the URL ends up
 * in the visited set.
 */
public enum PageOutcome {
    /** Fetched, and the cleaned text was long enough to be written to the corpus. */
    SAVED,

    /** Fetched, but too little text survived cleaning; nothing written. */
    SKIPPED_SHORT,

    /** Every fetch attempt failed (network error, timeout, non-2xx status, etc.). */
    FETCH_FAILED,

    /** Fetched and extracted, but the document could not be written to disk. */
    WRITE_FAILED;

    /**
     * @return true if the page was retrieved, i.e. it counts against the page budget
     */
    public boolean isFetched() {
        return this != FETCH_FAILED;
    }
}
