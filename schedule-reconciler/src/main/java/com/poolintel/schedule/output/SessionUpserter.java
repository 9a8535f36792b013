package com.poolintel.schedule.output;

import com.poolintel.schedule.model.CanonicalSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Upsert-by-hash against a {@link SessionStore}, one facility at a time.
 *
 * Each facility's new sessions go to the store as one batch. A failing batch is logged and
 * counted; batches already written stay written and the next facility is still attempted.
 * A hash is never inserted twice in one pass, even if the store has not caught up yet.
 */
@Slf4j
public class SessionUpserter {

    private final SessionStore store;

    public SessionUpserter(SessionStore store) {
        this.store = store;
    }

    public UpsertOutcome upsert(List<CanonicalSession> sessions) {
        Map<String, List<CanonicalSession>> byFacility = new TreeMap<>();
        for (CanonicalSession s : sessions) {
            if (!s.isResolved() || s.getContentHash() == null) continue;
            byFacility.computeIfAbsent(s.getFacilityId(), k -> new ArrayList<>()).add(s);
        }

        Set<String> seen = new HashSet<>();
        List<CanonicalSession> written = new ArrayList<>();
        int skipped = 0;
        int errors = 0;

        for (Map.Entry<String, List<CanonicalSession>> facility : byFacility.entrySet()) {
            List<CanonicalSession> batch = new ArrayList<>();
            Set<String> batchHashes = new HashSet<>();
            try {
                for (CanonicalSession s : facility.getValue()) {
                    if (seen.contains(s.getContentHash()) || batchHashes.contains(s.getContentHash())
                            || store.exists(s.getContentHash())) {
                        skipped++;
                        continue;
                    }
                    batch.add(s);
                    batchHashes.add(s.getContentHash());
                }
                store.insertAll(batch);
                seen.addAll(batchHashes);
                written.addAll(batch);
                log.debug("Facility {}: {} inserted", facility.getKey(), batch.size());
            } catch (RuntimeException e) {
                errors++;
                log.error("Persistence failed for facility {} ({} sessions): {}",
                        facility.getKey(), facility.getValue().size(), e.getMessage(), e);
            }
        }

        log.info("Upsert: {} inserted, {} already present, {} facility batches failed",
                written.size(), skipped, errors);
        return new UpsertOutcome(written, skipped, errors);
    }
}
