package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One bookable time slot at one facility: the unit of output.
 *
 * Schema design notes:
 *  - contentHash covers (facilityId, date, startTime, swimType) only. Notes, source and
 *    locationName never change it.
 *  - facilityId stays null until resolution succeeds. Such sessions are reported but never stored.
 *  - locationName is the upstream location label, kept for reporting and conflict grouping
 *    of unresolved sessions.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalSession {

    String facilityId;
    String locationName;
    String programName;

    SwimType swimType;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;

    String notes;
    String source;
    String sourceUrl;

    /** Confidence of the facility match, 0.0 when unmatched */
    double matchConfidence;

    String contentHash;

    public boolean isResolved() {
        return facilityId != null;
    }

    /** Facility id when resolved, otherwise the upstream location label. */
    public String facilityKey() {
        return facilityId != null ? facilityId : locationName;
    }

    public Duration duration() {
        if (startTime == null || endTime == null) return Duration.ZERO;
        return Duration.between(startTime, endTime);
    }
}
