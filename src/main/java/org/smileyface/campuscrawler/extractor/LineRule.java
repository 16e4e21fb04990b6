package org.smileyface.campuscrawler.extractor;

import java.util.Set;

/**
 * A filter applied to each trimmed line of flattened page text. Rules run in order and the
 * first one that rejects a line drops it.
 */
@FunctionalInterface
public interface LineRule {

    /**
     * @param line      the line, already trimmed
     * @param keptLines lines kept so far in this document, in order
     * @return true if the line may be kept
     */
    boolean isAccepted(String line, Set<String> keptLines);
}
