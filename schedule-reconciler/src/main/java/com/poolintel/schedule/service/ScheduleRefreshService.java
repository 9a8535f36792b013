package com.poolintel.schedule.service;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.PipelineResult;
import com.poolintel.schedule.model.PipelineStats;
import com.poolintel.schedule.model.RefreshReport;
import com.poolintel.schedule.model.RefreshRun;
import com.poolintel.schedule.model.RunParameters;
import com.poolintel.schedule.output.FacilityDirectory;
import com.poolintel.schedule.output.OutputRouter;
import com.poolintel.schedule.output.ReportExporter;
import com.poolintel.schedule.output.UpsertOutcome;
import com.poolintel.schedule.reconcile.SessionValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Orchestrates one refresh: snapshot the facility directory, run the pipeline, persist the
 * resolved and valid sessions, then record the run and export its report.
 *
 * In dry-run mode everything up to persistence runs and the report is still exported,
 * but nothing is written to the sinks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduleRefreshService {

    private final ReconcilerProperties properties;
    private final FacilityDirectory facilityDirectory;
    private final ReconciliationPipeline pipeline;
    private final SessionValidator validator;
    private final OutputRouter outputRouter;
    private final ReportExporter reportExporter;

    public PipelineResult refresh() {
        return refresh(properties.toRunParameters(), LocalDate.now());
    }

    public PipelineResult refresh(RunParameters parameters, LocalDate today) {
        boolean dryRun = properties.getRun().isDryRun();
        RefreshRun run = RefreshRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .weeksAhead(parameters.getWeeksAhead())
                .build();
        log.info("Refresh {} started (weeksAhead={}, optimize={}, threshold={}, dryRun={})",
                run.getRunId(), parameters.getWeeksAhead(), parameters.isOptimize(),
                parameters.getMatchThreshold(), dryRun);

        try {
            List<Facility> directory = facilityDirectory.snapshot();
            PipelineResult result = pipeline.run(parameters, directory, today);
            PipelineStats stats = result.getStats();

            List<CanonicalSession> accepted = result.getSessions().stream()
                    .filter(CanonicalSession::isResolved)
                    .filter(s -> validator.isValid(s, today))
                    .toList();
            long resolved = result.getSessions().stream().filter(CanonicalSession::isResolved).count();
            stats.setSessionsRejectedInvalid((int) resolved - accepted.size());

            if (dryRun) {
                log.info("Dry run: {} sessions would be persisted", accepted.size());
                run.setStatus("DRY_RUN");
            } else {
                UpsertOutcome outcome = outputRouter.write(accepted, today);
                stats.setSessionsInserted(outcome.inserted());
                stats.setSessionsSkippedExisting(outcome.skippedExisting());
                stats.setPersistenceErrors(outcome.persistenceErrors());
                run.setStatus(stats.getSourceFailures() > 0 || stats.getPersistenceErrors() > 0 ? "PARTIAL" : "SUCCESS");
            }

            run.setSessionsGenerated(stats.getSessionsGenerated());
            run.setSessionsInserted(stats.getSessionsInserted());
            run.setSessionsSkipped(stats.getSessionsSkippedExisting());
            run.setQualityScore(result.getQualityReport().getQualityScore());

            exportReport(run, parameters, dryRun, result);
            log.info("Refresh {} finished: {} | {}", run.getRunId(), run.getStatus(), stats);
            return result;

        } catch (RuntimeException e) {
            log.error("Refresh {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            if (!dryRun) {
                outputRouter.writeRefreshRun(run);
            }
        }
    }

    private void exportReport(RefreshRun run, RunParameters parameters, boolean dryRun, PipelineResult result) {
        RefreshReport report = RefreshReport.builder()
                .runId(run.getRunId())
                .generatedAt(LocalDateTime.now())
                .dryRun(dryRun)
                .parameters(parameters)
                .sessionCount(result.getSessions().size())
                .stats(result.getStats())
                .quality(result.getQualityReport())
                .coverage(result.getCoverage())
                .conflicts(result.getConflicts())
                .build();
        try {
            reportExporter.export(report);
        } catch (RuntimeException e) {
            log.warn("Could not export report for run {}: {}", run.getRunId(), e.getMessage());
        }
    }
}
