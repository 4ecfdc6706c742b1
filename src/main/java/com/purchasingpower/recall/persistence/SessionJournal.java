package com.purchasingpower.recall.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Human-readable record of reflected sessions. A session keeps one entry per
 * reflection cycle.
 *
 * @since 1.0.0
 */
public interface SessionJournal {

    /**
     * Record the entry under its session. An entry with the cycle id of an
     * earlier entry replaces it; a new cycle id is appended. Writing the same
     * entry twice leaves one entry.
     *
     * @throws com.purchasingpower.recall.exception.PersistenceFailureException on I/O failure
     */
    void write(JournalEntry entry);

    /**
     * @return the most recent cycle's entry for the session
     */
    Optional<JournalEntry> read(String sessionId);

    /**
     * @return every cycle's entry for the session, oldest first
     */
    List<JournalEntry> history(String sessionId);
}
