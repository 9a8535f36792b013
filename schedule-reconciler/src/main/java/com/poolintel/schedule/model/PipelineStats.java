package com.poolintel.schedule.model;

import lombok.Data;

/**
 * Counters for one pipeline run. Filled stage by stage, exported with the run report.
 */
@Data
public class PipelineStats {

    // ── Fetch / classify ────────────────────────────────────────────────────
    private int sourceFailures;
    private int totalPrograms;
    private int swimPrograms;
    private int nonSwimSkipped;

    // ── Expand / resolve ────────────────────────────────────────────────────
    private int parsingErrors;
    private int sessionsGenerated;
    private int facilitiesMatched;
    private int facilitiesUnmatched;

    // ── Conflicts ───────────────────────────────────────────────────────────
    private int conflictsDetected;
    private int conflictsResolved;

    // ── Persistence ─────────────────────────────────────────────────────────
    private int sessionsInserted;
    private int sessionsSkippedExisting;
    private int sessionsRejectedInvalid;
    private int persistenceErrors;
}
