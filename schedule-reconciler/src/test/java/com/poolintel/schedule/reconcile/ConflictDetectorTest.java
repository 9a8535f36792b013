package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.ConflictRecord;
import com.poolintel.schedule.model.SwimType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private static final LocalDate DATE = LocalDate.of(2025, 11, 3);

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    void overlappingPairIsReportedWithOverlap() {
        CanonicalSession a = session("F-1", SwimType.LANE_SWIM, "10:00", "11:30");
        CanonicalSession b = session("F-1", SwimType.AQUAFIT, "11:00", "12:30");

        List<ConflictRecord> conflicts = detector.detect(List.of(b, a));

        assertThat(conflicts).hasSize(1);
        ConflictRecord conflict = conflicts.get(0);
        assertThat(conflict.getOverlapMinutes()).isEqualTo(30);
        assertThat(conflict.getFirst()).isEqualTo(a);
        assertThat(conflict.getSecond()).isEqualTo(b);
        assertThat(conflict.getFacilityKey()).isEqualTo("F-1");
        assertThat(conflict.getDate()).isEqualTo(DATE);
    }

    @Test
    void disjointSessionsDoNotConflict() {
        assertThat(detector.detect(List.of(
                session("F-1", SwimType.LANE_SWIM, "10:00", "11:30"),
                session("F-1", SwimType.LANE_SWIM, "14:00", "15:30")))).isEmpty();
    }

    @Test
    void touchingSessionsDoNotConflict() {
        assertThat(detector.detect(List.of(
                session("F-1", SwimType.LANE_SWIM, "10:00", "11:00"),
                session("F-1", SwimType.AQUAFIT, "11:00", "12:00")))).isEmpty();
    }

    @Test
    void differentFacilitiesAreSeparateGroups() {
        assertThat(detector.detect(List.of(
                session("F-1", SwimType.LANE_SWIM, "10:00", "11:30"),
                session("F-2", SwimType.LANE_SWIM, "11:00", "12:30")))).isEmpty();
    }

    @Test
    void nestedSessionOverlapIsTheInnerDuration() {
        List<ConflictRecord> conflicts = detector.detect(List.of(
                session("F-1", SwimType.RECREATIONAL, "10:00", "13:00"),
                session("F-1", SwimType.AQUAFIT, "11:00", "12:00")));

        assertThat(conflicts).singleElement()
                .satisfies(c -> assertThat(c.getOverlapMinutes()).isEqualTo(60));
    }

    @Test
    void optimizePrefersLaneSwim() {
        CanonicalSession lane = session("F-1", SwimType.LANE_SWIM, "10:00", "11:00");
        CanonicalSession aquafit = session("F-1", SwimType.AQUAFIT, "10:30", "12:00");
        CanonicalSession evening = session("F-1", SwimType.RECREATIONAL, "18:00", "19:00");

        ConflictDetector.Resolution resolution = detector.optimize(List.of(aquafit, lane, evening));

        assertThat(resolution.kept()).containsExactly(lane, evening);
        assertThat(resolution.conflicts()).hasSize(1);
        assertThat(resolution.removed()).isEqualTo(1);
    }

    @Test
    void optimizeThenPrefersLongerSessions() {
        CanonicalSession shortRec = session("F-1", SwimType.RECREATIONAL, "10:00", "11:00");
        CanonicalSession longAquafit = session("F-1", SwimType.AQUAFIT, "10:30", "12:30");

        assertThat(detector.optimize(List.of(shortRec, longAquafit)).kept()).containsExactly(longAquafit);
    }

    @Test
    void optimizeLeavesConflictFreeInputUntouched() {
        List<CanonicalSession> sessions = List.of(
                session("F-1", SwimType.LANE_SWIM, "07:00", "08:00"),
                session("F-1", SwimType.LANE_SWIM, "12:00", "13:00"));

        ConflictDetector.Resolution resolution = detector.optimize(sessions);

        assertThat(resolution.kept()).isEqualTo(sessions);
        assertThat(resolution.conflicts()).isEmpty();
        assertThat(resolution.removed()).isZero();
    }

    private static CanonicalSession session(String facilityId, SwimType type, String start, String end) {
        return CanonicalSession.builder()
                .facilityId(facilityId)
                .swimType(type)
                .date(DATE)
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .source("test")
                .build();
    }
}
