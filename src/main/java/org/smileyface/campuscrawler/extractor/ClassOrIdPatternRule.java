package org.smileyface.campuscrawler.extractor;

import org.jsoup.nodes.Element;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A ContentRule that matches container elements whose {@code class} or {@code id} attribute looks
 * like page chrome (menus, sidebars, cookie banners, carousels, ...).
 * <p>
 * The pattern is searched (not fully matched) in the raw attribute value, so "main-nav" and
 * "navbar" both match a {@code nav} keyword. Only elements whose tag is one of the configured
 * container tags are considered; an empty container set means any element.
 */
public final class ClassOrIdPatternRule implements ContentRule {

    private final Pattern pattern;
    private final Set<String> containerTags;

    /**
     * @param pattern       noise keyword pattern, searched in class and id values
     * @param containerTags tag names this rule applies to (e.g. div, section, ul, aside)
     */
    public ClassOrIdPatternRule(Pattern pattern, Collection<String> containerTags) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
        this.pattern = pattern;
        Set<String> tags = new LinkedHashSet<>();
        if (containerTags != null) {
            for (String t : containerTags) {
                if (t != null && !t.isBlank()) tags.add(t.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.containerTags = Set.copyOf(tags);
    }

    /**
     * @param regex noise keyword regex, compiled case-insensitively
     */
    public ClassOrIdPatternRule(String regex, Collection<String> containerTags) {
        this(compile(regex), containerTags);
    }

    private static Pattern compile(String regex) {
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("regex must not be null/blank");
        }
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Set<String> getContainerTags() {
        return containerTags;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        if (!containerTags.isEmpty() && !containerTags.contains(element.normalName())) {
            return false;
        }
        return matches(element.className()) || matches(element.id());
    }

    private boolean matches(String value) {
        return value != null && !value.isEmpty() && pattern.matcher(value).find();
    }
}
