package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Audit document exported after each run.
 */
@Value
@Builder
public class RefreshReport {
    String runId;
    LocalDateTime generatedAt;
    boolean dryRun;
    RunParameters parameters;
    int sessionCount;
    PipelineStats stats;
    QualityReport quality;
    CoverageReport coverage;
    List<ConflictRecord> conflicts;
}
