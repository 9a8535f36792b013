package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each refresh run for observability.
 * Stored in the refresh_runs table in ClickHouse.
 */
@Data
@Builder
public class RefreshRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED | DRY_RUN
    private int weeksAhead;
    private int sessionsGenerated;
    private int sessionsInserted;
    private int sessionsSkipped;
    private double qualityScore;
    private String errorMessage;    // null on success
}
