package org.smileyface.campuscrawler.fetch;

import java.io.IOException;

/**
 * A page load that completed but did not report success.
 */
public class PageLoadException extends IOException {

    private final String url;
    private final int statusCode;

    public PageLoadException(String url, int statusCode, String message) {
        super("Loading " + url + " failed with status " + statusCode + (message == null ? "" : " (" + message + ")"));
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
