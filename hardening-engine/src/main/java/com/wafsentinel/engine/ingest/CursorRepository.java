package com.wafsentinel.engine.ingest;

import java.util.Optional;

/**
 * Durable storage of the single ingestion cursor.
 *
 * @author WAF Sentinel Team
 */
public interface CursorRepository {

    /** The persisted cursor, empty before the first commit. */
    Optional<CursorState> load();

    /**
     * Replace the persisted cursor.
     *
     * @throws CursorPersistenceException if the cursor cannot be written
     */
    void save(CursorState state);
}
