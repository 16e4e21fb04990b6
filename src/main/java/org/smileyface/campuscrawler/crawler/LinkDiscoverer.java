package org.smileyface.campuscrawler.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts the outbound, in-scope links of a page.
 * <p>
 * Every {@code a[href]} target is resolved against the current page and passed through the
 * {@link UrlNormalizer}; rejected targets are dropped and duplicates collapse to their first
 * appearance. The discoverer knows nothing about what has been visited or queued already.
 */
public class LinkDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(LinkDiscoverer.class);

    private final UrlNormalizer normalizer;

    public LinkDiscoverer(UrlNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * @param html       page markup (may be null/blank)
     * @param currentUrl absolute URL of the page, used as the base for relative links
     * @return normalized links in order of first appearance, without duplicates
     */
    public List<String> discover(String html, String currentUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, currentUrl == null ? "" : currentUrl);
        Set<String> found = new LinkedHashSet<>();
        int rejected = 0;
        for (Element a : doc.select("a[href]")) {
            String normalized = normalizer.normalizeAndValidate(a.attr("href"), currentUrl);
            if (normalized == null) {
                rejected++;
                continue;
            }
            found.add(normalized);
        }
        log.debug("Discovered {} links on {} ({} rejected)", found.size(), currentUrl, rejected);
        return new ArrayList<>(found);
    }
}
