package com.poolintel.schedule.reconcile;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts weekdays from free schedule text ("Mon/Wed", "Tuesdays", "Monday to Friday").
 * Unknown tokens are ignored.
 */
public final class WeekdayParser {

    private static final Map<String, DayOfWeek> NAMES = Map.ofEntries(
            Map.entry("monday", DayOfWeek.MONDAY), Map.entry("mon", DayOfWeek.MONDAY),
            Map.entry("tuesday", DayOfWeek.TUESDAY), Map.entry("tue", DayOfWeek.TUESDAY),
            Map.entry("tues", DayOfWeek.TUESDAY),
            Map.entry("wednesday", DayOfWeek.WEDNESDAY), Map.entry("wed", DayOfWeek.WEDNESDAY),
            Map.entry("thursday", DayOfWeek.THURSDAY), Map.entry("thu", DayOfWeek.THURSDAY),
            Map.entry("thur", DayOfWeek.THURSDAY), Map.entry("thurs", DayOfWeek.THURSDAY),
            Map.entry("friday", DayOfWeek.FRIDAY), Map.entry("fri", DayOfWeek.FRIDAY),
            Map.entry("saturday", DayOfWeek.SATURDAY), Map.entry("sat", DayOfWeek.SATURDAY),
            Map.entry("sunday", DayOfWeek.SUNDAY), Map.entry("sun", DayOfWeek.SUNDAY)
    );

    private static final Pattern TOKEN = Pattern.compile("[a-z]+");

    private static final Pattern DAY_SPAN = Pattern.compile(
            "\\b([a-z]+)\\s*(?:-|–|—|to|through|thru)\\s*([a-z]+)\\b");

    private WeekdayParser() {
    }

    public static Set<DayOfWeek> parse(String text) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (text == null || text.isBlank()) return days;

        String lower = text.toLowerCase(Locale.ROOT);

        Matcher span = DAY_SPAN.matcher(lower);
        while (span.find()) {
            Optional<DayOfWeek> from = lookup(span.group(1));
            Optional<DayOfWeek> to = lookup(span.group(2));
            if (from.isPresent() && to.isPresent()) {
                DayOfWeek d = from.get();
                days.add(d);
                while (d != to.get()) {
                    d = d.plus(1);
                    days.add(d);
                }
            }
        }

        Matcher token = TOKEN.matcher(lower);
        while (token.find()) {
            lookup(token.group()).ifPresent(days::add);
        }
        return days;
    }

    public static Optional<DayOfWeek> parseSingle(String text) {
        if (text == null) return Optional.empty();
        return lookup(text.trim().toLowerCase(Locale.ROOT));
    }

    private static Optional<DayOfWeek> lookup(String token) {
        DayOfWeek day = NAMES.get(token);
        if (day == null && token.length() > 3 && token.endsWith("s")) {
            day = NAMES.get(token.substring(0, token.length() - 1));
        }
        return Optional.ofNullable(day);
    }
}
