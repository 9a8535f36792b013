package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses "HH:MM - HH:MM" ranges in 12-hour or 24-hour form.
 *
 * Upstream text often carries the AM/PM designator on one side only
 * ("7:00 - 8:30 PM", "6:45 AM - 7:45"). The missing designator is inherited
 * from the sibling. Pairs whose end is not after the start are rejected.
 */
@Slf4j
public final class TimeRangeParser {

    private static final String TIME = "(\\d{1,2}:\\d{2}|\\d{1,2}(?=\\s*[ap]\\.?\\s*m\\b))";
    private static final String MERIDIEM = "(?:\\s*([ap])\\.?\\s*m\\b\\.?)?";

    private static final Pattern RANGE = Pattern.compile(
            "(?<![\\d:])" + TIME + MERIDIEM + "\\s*(?:-|–|—|to)\\s*" + TIME + MERIDIEM,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SINGLE = Pattern.compile(
            "^\\s*(\\d{1,2})(?::(\\d{2}))?" + MERIDIEM + "\\s*$",
            Pattern.CASE_INSENSITIVE);

    private TimeRangeParser() {
    }

    /**
     * Every valid range found in {@code text}, in order of appearance.
     */
    public static List<TimeRange> parseAll(String text) {
        List<TimeRange> ranges = new ArrayList<>();
        if (text == null || text.isBlank()) return ranges;

        Matcher m = RANGE.matcher(text);
        while (m.find()) {
            build(m.group(1), m.group(2), m.group(3), m.group(4)).ifPresent(ranges::add);
        }
        return ranges;
    }

    /** {@code text} with every range-shaped substring removed and whitespace collapsed. */
    public static String stripRanges(String text) {
        if (text == null) return "";
        return RANGE.matcher(text).replaceAll(" ").replaceAll("\\s+", " ").trim();
    }

    /**
     * Parses a start/end pair given as separate texts, e.g. "07:15 AM" and "08:10 AM".
     */
    public static Optional<TimeRange> parsePair(String startText, String endText) {
        if (startText == null || endText == null) return Optional.empty();
        Matcher start = SINGLE.matcher(startText);
        Matcher end = SINGLE.matcher(endText);
        if (!start.matches() || !end.matches()) {
            log.debug("Could not parse time pair: '{}' - '{}'", startText, endText);
            return Optional.empty();
        }
        return build(clock(start), start.group(3), clock(end), end.group(3));
    }

    private static String clock(Matcher single) {
        return single.group(1) + ":" + (single.group(2) != null ? single.group(2) : "00");
    }

    private static Optional<TimeRange> build(String startClock, String startMeridiem,
                                             String endClock, String endMeridiem) {
        String sm = startMeridiem;
        String em = endMeridiem;
        if (sm == null && em != null) sm = em;
        if (em == null && sm != null) em = sm;

        LocalTime start = toTime(startClock, sm);
        LocalTime end = toTime(endClock, em);
        if (start == null || end == null) {
            log.debug("Could not parse time range: {} - {}", startClock, endClock);
            return Optional.empty();
        }
        if (!end.isAfter(start)) {
            log.warn("Invalid time range rejected: {} - {}", start, end);
            return Optional.empty();
        }
        return Optional.of(new TimeRange(start, end));
    }

    static LocalTime toTime(String clock, String meridiem) {
        String[] parts = clock.contains(":") ? clock.split(":") : new String[]{clock, "00"};
        int hour;
        int minute;
        try {
            hour = Integer.parseInt(parts[0]);
            minute = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return null;
        }
        if (minute > 59) return null;

        if (meridiem == null) {
            return hour <= 23 ? LocalTime.of(hour, minute) : null;
        }
        if (hour < 1 || hour > 12) return null;
        boolean pm = meridiem.toLowerCase(Locale.ROOT).startsWith("p");
        int h24 = hour % 12 + (pm ? 12 : 0);
        return LocalTime.of(h24, minute);
    }
}
