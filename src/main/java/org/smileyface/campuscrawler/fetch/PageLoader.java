package org.smileyface.campuscrawler.fetch;

import java.io.IOException;

/**
 * Loads a single page in a single attempt.
 */
@FunctionalInterface
public interface PageLoader {

    /**
     * @param url       absolute URL
     * @param timeoutMs connect and read timeout in milliseconds
     * @return the page markup
     * @throws IOException on transport failures, timeouts, unsupported content or a
     *                     non-successful response ({@link PageLoadException})
     */
    String load(String url, int timeoutMs) throws IOException;
}
