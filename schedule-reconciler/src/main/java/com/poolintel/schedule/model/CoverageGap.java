package com.poolintel.schedule.model;

import java.time.DayOfWeek;

/**
 * A coverage finding: either an hour with no sessions ("time_gap") or a weekday
 * whose session count is well below the weekday mean ("low_coverage").
 */
public record CoverageGap(String type, Integer hour, DayOfWeek day, Integer count, String description) {

    public static final String TIME_GAP = "time_gap";
    public static final String LOW_COVERAGE = "low_coverage";
}
