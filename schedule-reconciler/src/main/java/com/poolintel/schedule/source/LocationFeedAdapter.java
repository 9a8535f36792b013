package com.poolintel.schedule.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.FeedInfoDocument;
import com.poolintel.schedule.model.FeedWeekDocument;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import com.poolintel.schedule.reconcile.DateTextParser;
import com.poolintel.schedule.reconcile.WeekdayParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-location JSON swim feed.
 *
 * For each curated location: {base}/{id}/swim/info.json lists the published weeks, then
 * {base}/{id}/swim/week{n}.json is read for n in 1..min(weeksAhead, weeks listed).
 * Every time slot becomes one dated record: week start plus the slot's weekday offset.
 *
 * A failing location or week is counted and skipped; the rest of the feed still loads.
 * Null lists in a payload read as empty.
 */
@Component
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class LocationFeedAdapter extends AbstractSourceAdapter {

    static final String SOURCE = "location-feed";

    private final UpstreamClient client;
    private final ObjectMapper objectMapper;
    private final ReconcilerProperties properties;

    @Override
    public String name() {
        return SOURCE;
    }

    @Override
    public boolean isEnabled() {
        ReconcilerProperties.Sources.LocationFeed feed = properties.getSources().getLocationFeed();
        return feed.isEnabled() && !feed.getLocations().isEmpty();
    }

    @Override
    protected List<RawCourseRecord> doFetch(RunParameters parameters) {
        ReconcilerProperties.Sources.LocationFeed feed = properties.getSources().getLocationFeed();
        List<RawCourseRecord> records = new ArrayList<>();

        for (ReconcilerProperties.Sources.FeedLocation location : feed.getLocations()) {
            String base = feed.getBaseUrl() + "/" + location.getLocationId() + "/swim";
            try {
                FeedInfoDocument info = objectMapper.readValue(client.fetchText(base + "/info.json"),
                        FeedInfoDocument.class);
                List<FeedInfoDocument.Week> weeks = info.getWeeks();
                int depth = Math.min(parameters.getWeeksAhead(), weeks.size());
                log.info("Location {} ({}): {} weeks published, reading {}",
                        location.getName(), location.getLocationId(), weeks.size(), depth);

                for (int n = 1; n <= depth; n++) {
                    records.addAll(fetchWeek(location, base, n, weeks.get(n - 1)));
                }
            } catch (IOException | RuntimeException e) {
                recordFailure("location " + location.getLocationId(), e);
            }
        }
        return records;
    }

    private List<RawCourseRecord> fetchWeek(ReconcilerProperties.Sources.FeedLocation location,
                                            String base, int weekNumber, FeedInfoDocument.Week week) {
        LocalDate weekStart = DateTextParser.parse(week.getTitle());
        if (weekStart == null) {
            log.warn("Location {}: could not parse start date '{}' of week {}",
                    location.getLocationId(), week.getTitle(), weekNumber);
            return List.of();
        }

        String url = base + "/week" + weekNumber + ".json";
        try {
            FeedWeekDocument document = objectMapper.readValue(client.fetchText(url), FeedWeekDocument.class);
            return toRecords(document, weekStart, location, url);
        } catch (IOException | RuntimeException e) {
            recordFailure("location " + location.getLocationId() + " week " + weekNumber, e);
            return List.of();
        }
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    List<RawCourseRecord> toRecords(FeedWeekDocument document, LocalDate weekStart,
                                    ReconcilerProperties.Sources.FeedLocation location, String url) {
        List<RawCourseRecord> records = new ArrayList<>();

        for (FeedWeekDocument.Program program : document.getPrograms()) {
            for (FeedWeekDocument.Section section : program.getDays()) {
                String title = blankToNull(section.getTitle()) != null ? section.getTitle() : program.getProgram();

                for (FeedWeekDocument.TimeSlot slot : section.getTimes()) {
                    Optional<DayOfWeek> day = WeekdayParser.parseSingle(slot.getDay());
                    if (day.isEmpty()) {
                        log.debug("Skipping slot with unknown day '{}'", slot.getDay());
                        continue;
                    }
                    String[] times = splitTimes(slot.getTitle());

                    records.add(RawCourseRecord.builder()
                            .title(title)
                            .category(program.getProgram())
                            .ageText(blankToNull(section.getAge()))
                            .dayText(slot.getDay())
                            .explicitDate(weekStart.plusDays(day.get().getValue() - 1L))
                            .startTimeText(times[0])
                            .endTimeText(times[1])
                            .scheduleText(slot.getTitle())
                            .locationId(location.getLocationId())
                            .locationName(location.getName())
                            .notes(notes(section.getAge(), program.getProgram(), title))
                            .source(SOURCE)
                            .sourceUrl(url)
                            .build());
                }
            }
        }
        return records;
    }

    /** "07:15 AM - 08:10 AM" → ["07:15 AM", "08:10 AM"]; missing parts are null. */
    static String[] splitTimes(String title) {
        if (title == null || !title.contains("-")) return new String[]{null, null};
        int dash = title.indexOf('-');
        return new String[]{blankToNull(title.substring(0, dash).trim()), blankToNull(title.substring(dash + 1).trim())};
    }

    static String notes(String age, String programName, String title) {
        List<String> parts = new ArrayList<>();
        if (blankToNull(age) != null) parts.add(age.trim());
        if (blankToNull(programName) != null && !programName.equals(title)) parts.add(programName.trim());
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
