package org.smileyface.campuscrawler.extractor;

import org.jsoup.nodes.Element;

/**
 * A rule used by ContentExtractor to decide whether a given HTML element is boilerplate.
 * A matched element is removed from the document together with its whole subtree.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * Returns true if the provided element matches this rule.
     *
     * @param element a Jsoup Element from the parsed HTML document (may be null)
     * @return true if matched
     */
    boolean isMatched(Element element);
}
