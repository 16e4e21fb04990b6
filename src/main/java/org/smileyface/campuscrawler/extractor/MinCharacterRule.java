package org.smileyface.campuscrawler.extractor;

import org.smileyface.campuscrawler.util.CrawlerUtils;

import java.util.Set;

/**
 * A LineRule that accepts lines whose length is at least a specified minimum number of characters.
 */
public final class MinCharacterRule implements LineRule {

    private final int minChars;

    /**
     * Creates a rule that accepts when the line length is greater than or equal to
     * {@code minChars}. Negative values are treated as zero.
     *
     * @param minChars minimum number of characters required
     */
    public MinCharacterRule(int minChars) {
        this.minChars = Math.max(0, minChars);
    }

    /**
     * @return the configured minimum characters threshold
     */
    public int getMinChars() {
        return minChars;
    }

    @Override
    public boolean isAccepted(String line, Set<String> keptLines) {
        return CrawlerUtils.charCount(line) >= minChars;
    }
}
