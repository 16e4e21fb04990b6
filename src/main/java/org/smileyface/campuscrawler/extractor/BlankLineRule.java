package org.smileyface.campuscrawler.extractor;

import java.util.Set;

/**
 * Drops empty lines.
 */
public final class BlankLineRule implements LineRule {

    @Override
    public boolean isAccepted(String line, Set<String> keptLines) {
        return line != null && !line.isEmpty();
    }
}
