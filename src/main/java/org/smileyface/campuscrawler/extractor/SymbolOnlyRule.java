package org.smileyface.campuscrawler.extractor;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops lines made only of punctuation, symbols or underscores (separators such as "----" or "| | |").
 */
public final class SymbolOnlyRule implements LineRule {

    private static final Pattern SYMBOLS_ONLY = Pattern.compile("[\\W_]+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public boolean isAccepted(String line, Set<String> keptLines) {
        if (line == null) return false;
        return !SYMBOLS_ONLY.matcher(line).matches();
    }
}
