package org.smileyface.campuscrawler.persist;

import org.smileyface.campuscrawler.model.FrontierState;

import java.io.IOException;

/**
 * Durable storage for the crawl checkpoint.
 */
public interface StatePersister {

    /**
     * Overwrites the stored checkpoint with {@code state}. A reader never observes a partially
     * written checkpoint.
     *
     * @throws IOException if the checkpoint could not be written; the previous one is left intact
     */
    void save(FrontierState state) throws IOException;

    /**
     * Loads the stored checkpoint.
     *
     * @return the checkpoint, or an empty state when none exists or it cannot be read
     */
    FrontierState load();
}
