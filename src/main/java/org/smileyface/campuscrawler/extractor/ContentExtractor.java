package org.smileyface.campuscrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.smileyface.campuscrawler.model.ExtractedPage;
import org.smileyface.campuscrawler.util.CrawlerUtils;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Converts raw page markup into a title and cleaned, deduplicated text by applying
 * {@link ExtractionRules}.
 */
public final class ContentExtractor {

    private final ExtractionRules rules;

    public ContentExtractor(ExtractionRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ExtractionRules getRules() {
        return rules;
    }

    /**
     * Parses the provided HTML, removes every subtree matched by an element rule (rules run in
     * order over the whole document), flattens what is left to one line per text node and keeps
     * the lines that pass every line rule, in document order.
     *
     * @param html the HTML content string (may be null/blank)
     * @return the page title and cleaned text; both empty for null/blank input
     */
    public ExtractedPage extract(String html) {
        if (html == null || html.isBlank()) {
            return ExtractedPage.EMPTY;
        }
        Document doc = Jsoup.parse(html);
        String title = CrawlerUtils.trimWhitespace(doc.title());

        removeNoise(doc);
        return new ExtractedPage(title, filterLines(flatten(doc)));
    }

    private void removeNoise(Document doc) {
        for (ContentRule rule : rules.getElementRules()) {
            // getAllElements() is a snapshot; removing an ancestor first just detaches its descendants
            for (Element el : doc.getAllElements()) {
                if (el == doc || el.parent() == null) continue;
                if (rule.isMatched(el)) {
                    el.remove();
                }
            }
        }
    }

    private static String flatten(Document doc) {
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode textNode) {
                sb.append(textNode.getWholeText()).append('\n');
            }
        }, doc);
        return sb.toString();
    }

    private String filterLines(String text) {
        Set<String> kept = new LinkedHashSet<>();
        text.lines().forEach(raw -> {
            String line = CrawlerUtils.trimWhitespace(raw);
            for (LineRule rule : rules.getLineRules()) {
                if (!rule.isAccepted(line, kept)) {
                    return;
                }
            }
            kept.add(line);
        });
        return String.join("\n", kept);
    }
}
