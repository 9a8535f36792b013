package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.CoverageGap;
import com.poolintel.schedule.model.CoverageReport;
import com.poolintel.schedule.model.HourCount;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Weekday and hour-of-day distribution of a session batch, with peak hours and gaps.
 * Sessions count toward the hour they start in. Both ends of the gap window are inclusive.
 */
@Component
public class CoverageAnalyzer {

    private final int startHour;
    private final int endHour;
    private final int peakHourCount;
    private final double lowCoverageRatio;

    @Autowired
    public CoverageAnalyzer(ReconcilerProperties properties) {
        this(properties.getQuality().getCoverageStartHour(), properties.getQuality().getCoverageEndHour(),
                properties.getQuality().getPeakHours(), properties.getQuality().getLowCoverageRatio());
    }

    public CoverageAnalyzer(int startHour, int endHour, int peakHourCount, double lowCoverageRatio) {
        this.startHour = startHour;
        this.endHour = endHour;
        this.peakHourCount = peakHourCount;
        this.lowCoverageRatio = lowCoverageRatio;
    }

    public CoverageReport analyze(List<CanonicalSession> sessions) {
        if (sessions.isEmpty()) {
            return CoverageReport.empty();
        }

        Map<DayOfWeek, Integer> byWeekday = new EnumMap<>(DayOfWeek.class);
        Map<Integer, Integer> byHour = new TreeMap<>();
        LocalDate first = null;
        LocalDate last = null;

        for (CanonicalSession s : sessions) {
            if (s.getDate() != null) {
                byWeekday.merge(s.getDate().getDayOfWeek(), 1, Integer::sum);
                if (first == null || s.getDate().isBefore(first)) first = s.getDate();
                if (last == null || s.getDate().isAfter(last)) last = s.getDate();
            }
            if (s.getStartTime() != null) {
                byHour.merge(s.getStartTime().getHour(), 1, Integer::sum);
            }
        }

        List<HourCount> peaks = byHour.entrySet().stream()
                .map(e -> new HourCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingInt(HourCount::count).reversed()
                        .thenComparingInt(HourCount::hour))
                .limit(peakHourCount)
                .toList();

        List<CoverageGap> gaps = new ArrayList<>();
        for (int hour = startHour; hour <= endHour; hour++) {
            if (!byHour.containsKey(hour)) {
                gaps.add(new CoverageGap(CoverageGap.TIME_GAP, hour, null, 0,
                        String.format("No sessions starting at %02d:00", hour)));
            }
        }

        if (!byWeekday.isEmpty()) {
            double mean = byWeekday.values().stream().mapToInt(Integer::intValue).average().orElse(0);
            for (Map.Entry<DayOfWeek, Integer> e : byWeekday.entrySet()) {
                if (e.getValue() < mean * lowCoverageRatio) {
                    gaps.add(new CoverageGap(CoverageGap.LOW_COVERAGE, null, e.getKey(), e.getValue(),
                            String.format("Low coverage on %s: %d sessions (mean %.1f)", e.getKey(), e.getValue(), mean)));
                }
            }
        }

        long facilities = sessions.stream()
                .map(CanonicalSession::facilityKey)
                .filter(Objects::nonNull)
                .distinct()
                .count();

        return CoverageReport.builder()
                .totalSessions(sessions.size())
                .facilitiesCount((int) facilities)
                .firstDate(first)
                .lastDate(last)
                .sessionsByWeekday(byWeekday)
                .sessionsByHour(byHour)
                .peakHours(peaks)
                .gaps(gaps)
                .build();
    }
}
