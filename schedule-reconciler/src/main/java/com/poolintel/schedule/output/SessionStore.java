package com.poolintel.schedule.output;

import com.poolintel.schedule.model.CanonicalSession;

import java.util.List;

/**
 * Durable session storage keyed by content hash. Both operations are idempotent from the
 * caller's side: callers check {@link #exists} first and never insert one hash twice per run.
 */
public interface SessionStore {

    boolean exists(String contentHash);

    void insert(CanonicalSession session);

    /**
     * Inserts a batch as one unit of work. Stores that can commit a batch atomically should
     * override this; the default inserts one by one.
     */
    default void insertAll(List<CanonicalSession> sessions) {
        for (CanonicalSession session : sessions) {
            insert(session);
        }
    }
}
