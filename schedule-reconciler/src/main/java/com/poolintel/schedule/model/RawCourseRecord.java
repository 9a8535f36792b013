package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Upstream-format-agnostic program record, produced by a source adapter.
 *
 * Only title and source are always present. Everything else depends on what
 * the upstream shape carries:
 *  - tabular dumps fill scheduleText and the declared start/end dates
 *  - the per-location JSON feed fills explicitDate plus start/end time text
 *  - HTML grids fill dayText plus start/end time text (explicitDate when the page is week-labelled)
 */
@Value
@Builder
public class RawCourseRecord {

    // ── Program ─────────────────────────────────────────────────────────────
    String title;
    String category;
    String ageText;

    // ── Schedule ────────────────────────────────────────────────────────────
    /** Free-text schedule, e.g. "Mon/Wed 7:00 - 8:30 AM" */
    String scheduleText;

    /** Explicit weekday field, e.g. "Tuesday" */
    String dayText;

    /** Concrete date when the source publishes dated events rather than a weekly pattern */
    LocalDate explicitDate;

    String startTimeText;
    String endTimeText;

    /** Declared validity window, raw upstream text */
    String startDateText;
    String endDateText;

    // ── Location ────────────────────────────────────────────────────────────
    String locationId;
    String locationName;
    String address;
    String postalCode;

    // ── Lineage ─────────────────────────────────────────────────────────────
    /** Notes assembled by the adapter (age range, category, program name) */
    String notes;

    /** Source tag, e.g. "tabular-dump" */
    String source;

    String sourceUrl;
}
