package org.smileyface.campuscrawler.model;

/**
 * Result of fetching one URL, possibly over several attempts. Never persisted.
 *
 * @param url       the URL that was requested
 * @param success   whether one of the attempts returned a page
 * @param rawMarkup page markup when successful, otherwise null
 * @param attempts  number of load attempts that were made
 */
public record PageFetchResult(String url, boolean success, String rawMarkup, int attempts) {

    public static PageFetchResult success(String url, String rawMarkup, int attempts) {
        return new PageFetchResult(url, true, rawMarkup == null ? "" : rawMarkup, attempts);
    }

    public static PageFetchResult failure(String url, int attempts) {
        return new PageFetchResult(url, false, null, attempts);
    }
}
