package org.smileyface.campuscrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A ContentRule that matches elements by their tag name.
 * Matching is case-insensitive and null-safe.
 */
public final class TagNameContentRule implements ContentRule {

    private final Set<String> tagNames;

    /**
     * Creates a rule that matches elements whose tag name equals one of the provided values
     * (case-insensitive).
     *
     * @param tagNames the HTML tag names to match (e.g., "script", "nav"). Must not be empty;
     *                 null/blank entries are rejected.
     */
    public TagNameContentRule(Collection<String> tagNames) {
        if (tagNames == null || tagNames.isEmpty()) {
            throw new IllegalArgumentException("tagNames must not be null/empty");
        }
        Set<String> names = new LinkedHashSet<>();
        for (String tagName : tagNames) {
            if (tagName == null || tagName.isBlank()) {
                throw new IllegalArgumentException("tagName must not be null/blank");
            }
            names.add(tagName.trim().toLowerCase(Locale.ROOT));
        }
        this.tagNames = Set.copyOf(names);
    }

    public TagNameContentRule(String... tagNames) {
        this(tagNames == null ? null : Arrays.asList(tagNames));
    }

    /**
     * @return the configured tag names, lower-cased
     */
    public Set<String> getTagNames() {
        return tagNames;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return tagNames.contains(element.normalName());
    }
}
