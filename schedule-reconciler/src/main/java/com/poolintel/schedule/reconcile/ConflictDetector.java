package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.ConflictRecord;
import com.poolintel.schedule.model.SwimType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Finds overlapping sessions per (facility, date) and optionally resolves them.
 *
 * Detection sorts each group by start time (stable) and compares adjacent pairs only.
 * Optimisation keeps, per conflicting group, the highest-priority sessions that do not overlap
 * anything already kept: lane swim first, then longer duration, then original order.
 */
@Component
@Slf4j
public class ConflictDetector {

    static final Comparator<CanonicalSession> PRIORITY =
            Comparator.comparing((CanonicalSession s) -> s.getSwimType() == SwimType.LANE_SWIM ? 0 : 1)
                    .thenComparing(CanonicalSession::duration, Comparator.reverseOrder());

    public record Resolution(List<CanonicalSession> kept, List<ConflictRecord> conflicts, int removed) {}

    public List<ConflictRecord> detect(List<CanonicalSession> sessions) {
        List<ConflictRecord> conflicts = new ArrayList<>();
        for (Map.Entry<GroupKey, List<CanonicalSession>> group : group(sessions).entrySet()) {
            conflicts.addAll(detectInGroup(group.getKey(), group.getValue()));
        }
        if (!conflicts.isEmpty()) {
            log.info("Detected {} schedule conflicts", conflicts.size());
        }
        return conflicts;
    }

    public Resolution optimize(List<CanonicalSession> sessions) {
        List<ConflictRecord> conflicts = new ArrayList<>();
        Set<CanonicalSession> discarded = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Map.Entry<GroupKey, List<CanonicalSession>> group : group(sessions).entrySet()) {
            List<ConflictRecord> found = detectInGroup(group.getKey(), group.getValue());
            if (found.isEmpty()) continue;
            conflicts.addAll(found);

            List<CanonicalSession> byPriority = new ArrayList<>(group.getValue());
            byPriority.sort(PRIORITY);
            List<CanonicalSession> kept = new ArrayList<>();
            for (CanonicalSession candidate : byPriority) {
                boolean clashes = kept.stream().anyMatch(k -> overlaps(k, candidate));
                if (clashes) {
                    discarded.add(candidate);
                } else {
                    kept.add(candidate);
                }
            }
        }

        List<CanonicalSession> result = new ArrayList<>(sessions.size() - discarded.size());
        for (CanonicalSession s : sessions) {
            if (!discarded.contains(s)) result.add(s);
        }
        if (!discarded.isEmpty()) {
            log.info("Resolved {} conflicts by discarding {} sessions", conflicts.size(), discarded.size());
        }
        return new Resolution(result, conflicts, discarded.size());
    }

    // ── Internals ───────────────────────────────────────────────────────────

    private List<ConflictRecord> detectInGroup(GroupKey key, List<CanonicalSession> group) {
        if (group.size() < 2) return List.of();
        List<CanonicalSession> sorted = new ArrayList<>(group);
        sorted.sort(Comparator.comparing(CanonicalSession::getStartTime));

        List<ConflictRecord> conflicts = new ArrayList<>();
        for (int i = 0; i + 1 < sorted.size(); i++) {
            CanonicalSession a = sorted.get(i);
            CanonicalSession b = sorted.get(i + 1);
            if (a.getEndTime().isAfter(b.getStartTime())) {
                LocalTime overlapEnd = a.getEndTime().isBefore(b.getEndTime()) ? a.getEndTime() : b.getEndTime();
                conflicts.add(new ConflictRecord(key.facilityKey(), key.date(), a, b,
                        Duration.between(b.getStartTime(), overlapEnd)));
            }
        }
        return conflicts;
    }

    private static boolean overlaps(CanonicalSession a, CanonicalSession b) {
        return a.getStartTime().isBefore(b.getEndTime()) && b.getStartTime().isBefore(a.getEndTime());
    }

    /** Sessions without times or a date cannot conflict and are left out of every group. */
    private static Map<GroupKey, List<CanonicalSession>> group(List<CanonicalSession> sessions) {
        Map<GroupKey, List<CanonicalSession>> groups = new LinkedHashMap<>();
        for (CanonicalSession s : sessions) {
            if (s.getDate() == null || s.getStartTime() == null || s.getEndTime() == null) continue;
            groups.computeIfAbsent(new GroupKey(s.facilityKey(), s.getDate()), k -> new ArrayList<>()).add(s);
        }
        return groups;
    }

    private record GroupKey(String facilityKey, LocalDate date) {
        GroupKey {
            facilityKey = Objects.requireNonNullElse(facilityKey, "");
        }
    }
}
