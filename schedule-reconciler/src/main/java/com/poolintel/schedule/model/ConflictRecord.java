package com.poolintel.schedule.model;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Two sessions at one facility on one date whose time ranges overlap.
 * {@code first} starts no later than {@code second}.
 */
@Value
public class ConflictRecord {
    String facilityKey;
    LocalDate date;
    CanonicalSession first;
    CanonicalSession second;
    Duration overlap;

    public long getOverlapMinutes() {
        return overlap.toMinutes();
    }
}
