package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.CoverageGap;
import com.poolintel.schedule.model.CoverageReport;
import com.poolintel.schedule.model.HourCount;
import com.poolintel.schedule.model.SwimType;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageAnalyzerTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 3);

    private final CoverageAnalyzer analyzer = new CoverageAnalyzer(6, 22, 5, 0.5);

    @Test
    void distributionPeaksAndGaps() {
        List<CanonicalSession> sessions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            sessions.add(session("F-1", MONDAY, 7));
            sessions.add(session("F-2", MONDAY.plusDays(1), 7));
        }
        sessions.add(session("F-1", MONDAY.plusDays(2), 18));

        CoverageReport report = analyzer.analyze(sessions);

        assertThat(report.getTotalSessions()).isEqualTo(7);
        assertThat(report.getFacilitiesCount()).isEqualTo(2);
        assertThat(report.getFirstDate()).isEqualTo(MONDAY);
        assertThat(report.getLastDate()).isEqualTo(MONDAY.plusDays(2));
        assertThat(report.getSessionsByWeekday())
                .containsEntry(DayOfWeek.MONDAY, 3)
                .containsEntry(DayOfWeek.TUESDAY, 3)
                .containsEntry(DayOfWeek.WEDNESDAY, 1);
        assertThat(report.getSessionsByHour()).containsEntry(7, 6).containsEntry(18, 1);
        assertThat(report.getPeakHours()).containsExactly(new HourCount(7, 6), new HourCount(18, 1));

        assertThat(report.getGaps())
                .filteredOn(g -> g.type().equals(CoverageGap.TIME_GAP))
                .hasSize(15)
                .extracting(CoverageGap::hour)
                .doesNotContain(7, 18)
                .contains(6, 12, 21, 22);
        assertThat(report.getGaps())
                .filteredOn(g -> g.type().equals(CoverageGap.LOW_COVERAGE))
                .extracting(CoverageGap::day)
                .containsExactly(DayOfWeek.WEDNESDAY);
    }

    @Test
    void lastHourOfTheWindowIsChecked() {
        List<CanonicalSession> sessions = List.of(session("F-1", MONDAY, 7));

        assertThat(analyzer.analyze(sessions).getGaps())
                .filteredOn(g -> g.type().equals(CoverageGap.TIME_GAP))
                .extracting(CoverageGap::hour)
                .startsWith(6, 8)
                .endsWith(21, 22)
                .doesNotContain(5, 7, 23);

        List<CanonicalSession> lateSwim = List.of(session("F-1", MONDAY, 7), session("F-1", MONDAY, 22));
        assertThat(analyzer.analyze(lateSwim).getGaps())
                .extracting(CoverageGap::hour)
                .doesNotContain(22);
    }

    @Test
    void emptyInputGivesEmptyReport() {
        CoverageReport report = analyzer.analyze(List.of());

        assertThat(report.getTotalSessions()).isZero();
        assertThat(report.getGaps()).isEmpty();
        assertThat(report.getPeakHours()).isEmpty();
    }

    private static CanonicalSession session(String facilityId, LocalDate date, int hour) {
        return CanonicalSession.builder()
                .facilityId(facilityId)
                .swimType(SwimType.LANE_SWIM)
                .date(date)
                .startTime(LocalTime.of(hour, 0))
                .endTime(LocalTime.of(hour + 1, 0))
                .build();
    }
}
