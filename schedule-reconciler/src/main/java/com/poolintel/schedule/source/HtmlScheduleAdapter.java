package com.poolintel.schedule.source;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import com.poolintel.schedule.reconcile.DateTextParser;
import com.poolintel.schedule.reconcile.TimeRangeParser;
import com.poolintel.schedule.reconcile.WeekdayParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Facility pages carrying a weekly schedule grid.
 *
 * A table is a schedule grid when its header row names at least two weekdays. The header
 * maps column index → weekday; each data row is a program name (first cell) plus, per
 * weekday cell, zero or more stacked time slots separated by line breaks. A fragment with
 * no parseable time range is skipped.
 *
 * When the page carries a "For the week of ..." label the records get explicit dates,
 * otherwise they carry the weekday only and are expanded as a weekly pattern.
 */
@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class HtmlScheduleAdapter extends AbstractSourceAdapter {

    static final String SOURCE = "facility-page";

    private static final Pattern WEEK_OF = Pattern.compile(
            "for\\s+the\\s+week\\s+of\\s*:?\\s*([A-Za-z]+\\s+\\d{1,2},\\s*\\d{4}|\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>|\\n");

    private static final int MIN_WEEKDAY_COLUMNS = 2;

    private final UpstreamClient client;
    private final ReconcilerProperties properties;

    @Override
    public String name() {
        return SOURCE;
    }

    @Override
    public boolean isEnabled() {
        ReconcilerProperties.Sources.Html html = properties.getSources().getHtml();
        return html.isEnabled() && !html.getPages().isEmpty();
    }

    @Override
    protected List<RawCourseRecord> doFetch(RunParameters parameters) {
        List<RawCourseRecord> records = new ArrayList<>();
        for (ReconcilerProperties.Sources.HtmlPage page : properties.getSources().getHtml().getPages()) {
            try {
                String html = client.fetchText(page.getUrl());
                List<RawCourseRecord> pageRecords = parsePage(html, page.getUrl(), page.getLocationName());
                log.info("Page {}: {} schedule slots", page.getUrl(), pageRecords.size());
                records.addAll(pageRecords);
            } catch (IOException e) {
                recordFailure("page " + page.getUrl(), e);
            }
        }
        return records;
    }

    // ── Page parsing ─────────────────────────────────────────────────────────

    List<RawCourseRecord> parsePage(String html, String url, String configuredLocation) {
        Document doc = Jsoup.parse(html, url);
        doc.select("script,noscript,style").remove();

        String locationName = configuredLocation != null && !configuredLocation.isBlank()
                ? configuredLocation
                : pageTitle(doc);
        LocalDate weekStart = weekOf(doc.text());

        List<RawCourseRecord> records = new ArrayList<>();
        for (Element table : doc.select("table")) {
            records.addAll(parseTable(table, locationName, weekStart, url));
        }
        return records;
    }

    private List<RawCourseRecord> parseTable(Element table, String locationName, LocalDate weekStart, String url) {
        Elements rows = table.select("tr");
        if (rows.isEmpty()) return List.of();

        Map<Integer, DayOfWeek> columns = weekdayColumns(rows.get(0));
        if (columns.size() < MIN_WEEKDAY_COLUMNS) {
            return List.of();
        }

        List<RawCourseRecord> records = new ArrayList<>();
        for (int r = 1; r < rows.size(); r++) {
            Elements cells = rows.get(r).select("th,td");
            String rowLabel = cells.isEmpty() || columns.containsKey(0) ? null : blankToNull(cells.get(0).text());

            for (Map.Entry<Integer, DayOfWeek> column : columns.entrySet()) {
                if (column.getKey() >= cells.size()) continue;
                DayOfWeek day = column.getValue();
                for (String fragment : fragments(cells.get(column.getKey()))) {
                    if (TimeRangeParser.parseAll(fragment).isEmpty()) {
                        log.debug("Skipping cell fragment without a time range: '{}'", fragment);
                        continue;
                    }
                    String label = blankToNull(TimeRangeParser.stripRanges(fragment));
                    String title = label != null ? label : rowLabel;
                    if (title == null) {
                        log.debug("Skipping untitled slot '{}' on {}", fragment, day);
                        continue;
                    }
                    records.add(RawCourseRecord.builder()
                            .title(title)
                            .category(label != null ? rowLabel : null)
                            .dayText(day.name())
                            .scheduleText(fragment)
                            .explicitDate(weekStart != null ? weekStart.with(TemporalAdjusters.nextOrSame(day)) : null)
                            .locationName(locationName)
                            .source(SOURCE)
                            .sourceUrl(url)
                            .build());
                }
            }
        }
        return records;
    }

    static Map<Integer, DayOfWeek> weekdayColumns(Element headerRow) {
        Map<Integer, DayOfWeek> columns = new HashMap<>();
        Elements cells = headerRow.select("th,td");
        for (int i = 0; i < cells.size(); i++) {
            Optional<DayOfWeek> day = WeekdayParser.parseSingle(cells.get(i).text());
            final int column = i;
            day.ifPresent(d -> columns.put(column, d));
        }
        return columns;
    }

    /** Cell text split on line breaks, each fragment whitespace-collapsed and non-blank. */
    static List<String> fragments(Element cell) {
        List<String> fragments = new ArrayList<>();
        for (String part : LINE_BREAK.split(cell.html())) {
            String text = Jsoup.parseBodyFragment(part).text().trim();
            if (!text.isEmpty()) fragments.add(text);
        }
        return fragments;
    }

    static LocalDate weekOf(String pageText) {
        Matcher m = WEEK_OF.matcher(pageText);
        if (!m.find()) return null;
        LocalDate date = DateTextParser.parse(m.group(1).replaceAll("\\s+", " "));
        return date == null ? null : date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private static String pageTitle(Document doc) {
        Element h1 = doc.selectFirst("h1");
        if (h1 != null && !h1.text().isBlank()) return h1.text().trim();
        String title = doc.title();
        return title.isBlank() ? null : title.replaceAll("\\s*-\\s*City of Toronto.*$", "").trim();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
