package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PipelineResult {
    List<CanonicalSession> sessions;
    PipelineStats stats;
    QualityReport qualityReport;
    CoverageReport coverage;
    List<ConflictRecord> conflicts;
}
