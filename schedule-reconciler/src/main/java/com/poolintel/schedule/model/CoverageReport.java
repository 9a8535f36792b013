package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CoverageReport {
    int totalSessions;
    int facilitiesCount;
    LocalDate firstDate;
    LocalDate lastDate;
    Map<DayOfWeek, Integer> sessionsByWeekday;
    Map<Integer, Integer> sessionsByHour;
    List<HourCount> peakHours;
    List<CoverageGap> gaps;

    public static CoverageReport empty() {
        return CoverageReport.builder()
                .sessionsByWeekday(Map.of())
                .sessionsByHour(Map.of())
                .peakHours(List.of())
                .gaps(List.of())
                .build();
    }
}
