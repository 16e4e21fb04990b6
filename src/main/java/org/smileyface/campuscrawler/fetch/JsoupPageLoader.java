package org.smileyface.campuscrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link PageLoader} backed by Jsoup's HTTP client. Redirects are followed; any final status outside
 * 2xx is reported as a {@link PageLoadException}. Non-HTML content types are rejected by Jsoup itself.
 */
public class JsoupPageLoader implements PageLoader {

    private final String userAgent;

    public JsoupPageLoader(String userAgent) {
        this.userAgent = Objects.toString(userAgent, "SmileyfaceCampusCrawler/0.1");
    }

    @Override
    public String load(String url, int timeoutMs) throws IOException {
        Connection conn = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(Math.max(0, timeoutMs))
                .followRedirects(true)
                .ignoreHttpErrors(true);

        Connection.Response res = conn.execute();
        int status = res.statusCode();
        if (status < 200 || status >= 300) {
            throw new PageLoadException(url, status, res.statusMessage());
        }
        return res.body();
    }
}
