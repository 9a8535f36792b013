package com.poolintel.schedule.reconcile;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Lenient date parsing for the date formats seen in upstream dumps and page labels.
 */
public final class DateTextParser {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH)
    );

    private DateTextParser() {
    }

    /**
     * @return the parsed date, or null when the text is blank or matches no known format
     */
    public static LocalDate parse(String text) {
        if (text == null || text.isBlank()) return null;
        String trimmed = text.trim();
        // Dumps sometimes carry a timestamp, e.g. "2025-01-06T00:00:00"
        if (trimmed.length() > 10 && trimmed.charAt(4) == '-' && trimmed.charAt(10) == 'T') {
            trimmed = trimmed.substring(0, 10);
        }
        for (DateTimeFormatter format : FORMATS) {
            LocalDate date = tryParse(trimmed, format);
            if (date != null) return date;
        }
        return null;
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
