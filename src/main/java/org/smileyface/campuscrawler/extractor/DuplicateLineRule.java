package org.smileyface.campuscrawler.extractor;

import java.util.Set;

/**
 * Drops a line that is an exact copy of a line already kept in the same document. The first
 * occurrence wins, which also removes menu text echoed in page bodies.
 */
public final class DuplicateLineRule implements LineRule {

    @Override
    public boolean isAccepted(String line, Set<String> keptLines) {
        return keptLines == null || !keptLines.contains(line);
    }
}
