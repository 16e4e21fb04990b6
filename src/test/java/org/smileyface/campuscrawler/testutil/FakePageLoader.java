package org.smileyface.campuscrawler.testutil;

import org.smileyface.campuscrawler.fetch.PageLoadException;
import org.smileyface.campuscrawler.fetch.PageLoader;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PageLoader serving canned pages by URL. Unknown URLs answer 404. Every load attempt is recorded.
 */
public class FakePageLoader implements PageLoader {

    private final Map<String, String> pages = new LinkedHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    public FakePageLoader page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    @Override
    public String load(String url, int timeoutMs) throws IOException {
        requests.add(url);
        String html = pages.get(url);
        if (html == null) {
            throw new PageLoadException(url, 404, "Not Found");
        }
        return html;
    }

    public List<String> getRequests() {
        return requests;
    }

    /**
     * Builds a page whose text survives cleaning and is longer than 150 characters, linking to the
     * given hrefs.
     */
    public static String htmlPage(String name, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><head><title>").append(name).append("</title></head><body>");
        for (String href : hrefs) {
            sb.append("<a href=\"").append(href).append("\">Link to ").append(href).append(" from ").append(name).append("</a>");
        }
        sb.append("<p>Welcome to the ").append(name).append(" page of the university website.</p>")
                .append("<p>The ").append(name).append(" office supports students throughout the academic year.</p>")
                .append("<p>Contact the ").append(name).append(" team for information about programs and services.</p>")
                .append("</body></html>");
        return sb.toString();
    }

    /**
     * Builds a page with too little text to be written, linking to the given hrefs.
     */
    public static String shortPage(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String href : hrefs) {
            sb.append("<a href=\"").append(href).append("\">go</a>");
        }
        return sb.append("<p>Coming soon</p></body></html>").toString();
    }
}
