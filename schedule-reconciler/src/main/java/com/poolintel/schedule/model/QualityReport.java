package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Aggregate validation outcome for a batch of sessions.
 * qualityScore = validSessions / totalSessions (0.0 for an empty batch).
 */
@Value
@Builder
public class QualityReport {
    int totalSessions;
    int validSessions;
    int invalidSessions;
    Map<String, Integer> issuesByType;
    double qualityScore;
    List<String> recommendations;
}
