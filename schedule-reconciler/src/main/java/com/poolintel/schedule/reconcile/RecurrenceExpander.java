package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.ClassifiedCourse;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a classified program into dated session instances.
 *
 * Two input shapes are supported:
 *  - an explicit date (sources that publish dated events): the date itself plus the same
 *    weekday projected forward a few whole weeks, because such sources often only cover one week
 *  - a weekday pattern: every matching date in [effectiveStart, effectiveStart + horizon),
 *    where effectiveStart = max(today, declared start) and a declared end date caps the window
 *
 * Pure: "today" is a parameter, and output order is date ascending then time-range order.
 */
@Component
@Slf4j
public class RecurrenceExpander {

    private final int explicitDateProjectionWeeks;

    @Autowired
    public RecurrenceExpander(ReconcilerProperties properties) {
        this(properties.getExpansion().getExplicitDateProjectionWeeks());
    }

    public RecurrenceExpander(int explicitDateProjectionWeeks) {
        this.explicitDateProjectionWeeks = Math.max(0, explicitDateProjectionWeeks);
    }

    public List<CanonicalSession> expand(ClassifiedCourse course, LocalDate today, int horizonWeeks)
            throws UnparsableScheduleException {
        RawCourseRecord record = course.getRecord();

        List<TimeRange> ranges = timeRanges(record);
        if (ranges.isEmpty()) {
            throw new UnparsableScheduleException("No valid time range in '" + describeTimes(record) + "'");
        }

        List<LocalDate> dates = record.getExplicitDate() != null
                ? projectExplicitDate(record, today, horizonWeeks)
                : enumeratePattern(record, today, horizonWeeks);

        List<CanonicalSession> sessions = new ArrayList<>(dates.size() * ranges.size());
        for (LocalDate date : dates) {
            for (TimeRange range : ranges) {
                sessions.add(CanonicalSession.builder()
                        .locationName(record.getLocationName())
                        .programName(record.getTitle())
                        .swimType(course.getClassification().getSwimType())
                        .date(date)
                        .startTime(range.start())
                        .endTime(range.end())
                        .notes(record.getNotes())
                        .source(record.getSource())
                        .sourceUrl(record.getSourceUrl())
                        .build());
            }
        }
        return sessions;
    }

    // ── Dates ───────────────────────────────────────────────────────────────

    List<LocalDate> projectExplicitDate(RawCourseRecord record, LocalDate today, int horizonWeeks) {
        LocalDate given = record.getExplicitDate();
        LocalDate horizonEnd = today.plusWeeks(horizonWeeks);
        LocalDate declaredEnd = DateTextParser.parse(record.getEndDateText());

        List<LocalDate> dates = new ArrayList<>();
        dates.add(given);
        for (int week = 1; week <= explicitDateProjectionWeeks; week++) {
            LocalDate projected = given.plusWeeks(week);
            if (!projected.isBefore(horizonEnd)) break;
            if (declaredEnd != null && projected.isAfter(declaredEnd)) break;
            dates.add(projected);
        }
        return dates;
    }

    List<LocalDate> enumeratePattern(RawCourseRecord record, LocalDate today, int horizonWeeks)
            throws UnparsableScheduleException {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        days.addAll(WeekdayParser.parse(record.getDayText()));
        days.addAll(WeekdayParser.parse(record.getScheduleText()));
        if (days.isEmpty()) {
            throw new UnparsableScheduleException("No weekday in '" + record.getDayText() + " "
                    + record.getScheduleText() + "'");
        }

        LocalDate declaredStart = DateTextParser.parse(record.getStartDateText());
        LocalDate declaredEnd = DateTextParser.parse(record.getEndDateText());

        LocalDate effectiveStart = declaredStart != null && declaredStart.isAfter(today) ? declaredStart : today;
        LocalDate endExclusive = effectiveStart.plusWeeks(horizonWeeks);
        if (declaredEnd != null && declaredEnd.plusDays(1).isBefore(endExclusive)) {
            endExclusive = declaredEnd.plusDays(1);
        }

        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = effectiveStart; d.isBefore(endExclusive); d = d.plusDays(1)) {
            if (days.contains(d.getDayOfWeek())) {
                dates.add(d);
            }
        }
        return dates;
    }

    // ── Times ───────────────────────────────────────────────────────────────

    List<TimeRange> timeRanges(RawCourseRecord record) {
        if (notBlank(record.getStartTimeText()) && notBlank(record.getEndTimeText())) {
            return TimeRangeParser.parsePair(record.getStartTimeText(), record.getEndTimeText())
                    .map(List::of)
                    .orElse(List.of());
        }
        return TimeRangeParser.parseAll(record.getScheduleText());
    }

    private String describeTimes(RawCourseRecord record) {
        if (notBlank(record.getStartTimeText()) || notBlank(record.getEndTimeText())) {
            return record.getStartTimeText() + " - " + record.getEndTimeText();
        }
        return record.getScheduleText();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
