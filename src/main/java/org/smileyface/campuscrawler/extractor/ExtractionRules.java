package org.smileyface.campuscrawler.extractor;

import java.util.List;

/**
 * The ordered rule set driving {@link ContentExtractor}: element rules first (each removes matching
 * subtrees from the DOM), then line rules (each may drop a line of the flattened text).
 */
public final class ExtractionRules {

    private final List<ContentRule> elementRules;
    private final List<LineRule> lineRules;

    public ExtractionRules(List<ContentRule> elementRules, List<LineRule> lineRules) {
        this.elementRules = elementRules == null ? List.of() : List.copyOf(elementRules);
        this.lineRules = lineRules == null ? List.of() : List.copyOf(lineRules);
    }

    public List<ContentRule> getElementRules() {
        return elementRules;
    }

    public List<LineRule> getLineRules() {
        return lineRules;
    }

    @Override
    public String toString() {
        return "ExtractionRules{" +
                "elementRules=" + elementRules.size() +
                ", lineRules=" + lineRules.size() +
                '}';
    }
}
