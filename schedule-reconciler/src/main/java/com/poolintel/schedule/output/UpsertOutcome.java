package com.poolintel.schedule.output;

import com.poolintel.schedule.model.CanonicalSession;

import java.util.List;

/**
 * What one persistence pass did. {@code written} holds the sessions newly stored or exported.
 */
public record UpsertOutcome(List<CanonicalSession> written, int skippedExisting, int persistenceErrors) {

    public int inserted() {
        return written.size();
    }
}
