package com.poolintel.schedule.service;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.ClassificationResult;
import com.poolintel.schedule.model.ClassifiedCourse;
import com.poolintel.schedule.model.ConflictRecord;
import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;
import com.poolintel.schedule.model.PipelineResult;
import com.poolintel.schedule.model.PipelineStats;
import com.poolintel.schedule.model.RawCourseRecord;
import com.poolintel.schedule.model.RunParameters;
import com.poolintel.schedule.reconcile.ActivityClassifier;
import com.poolintel.schedule.reconcile.ConflictDetector;
import com.poolintel.schedule.reconcile.CoverageAnalyzer;
import com.poolintel.schedule.reconcile.FacilityResolver;
import com.poolintel.schedule.reconcile.QualityReporter;
import com.poolintel.schedule.reconcile.RecurrenceExpander;
import com.poolintel.schedule.reconcile.SessionIdentity;
import com.poolintel.schedule.reconcile.UnparsableScheduleException;
import com.poolintel.schedule.source.SourceAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One reconciliation pass, from upstream fetch to quality report. Does not persist.
 *
 *   fetch (sources in parallel) → classify → expand → resolve + hash → collapse duplicates
 *   → conflicts (optionally resolved) → quality → coverage
 *
 * Bad data is counted, never fatal. The run aborts only when no source yields anything.
 */
@Service
@Slf4j
public class ReconciliationPipeline {

    private final List<SourceAdapter> adapters;
    private final Executor fetchExecutor;
    private final ActivityClassifier classifier;
    private final RecurrenceExpander expander;
    private final FacilityResolver resolver;
    private final ConflictDetector conflictDetector;
    private final QualityReporter qualityReporter;
    private final CoverageAnalyzer coverageAnalyzer;

    public ReconciliationPipeline(List<SourceAdapter> adapters,
                                  @Qualifier("fetchExecutor") Executor fetchExecutor,
                                  ActivityClassifier classifier,
                                  RecurrenceExpander expander,
                                  FacilityResolver resolver,
                                  ConflictDetector conflictDetector,
                                  QualityReporter qualityReporter,
                                  CoverageAnalyzer coverageAnalyzer) {
        this.adapters = adapters;
        this.fetchExecutor = fetchExecutor;
        this.classifier = classifier;
        this.expander = expander;
        this.resolver = resolver;
        this.conflictDetector = conflictDetector;
        this.qualityReporter = qualityReporter;
        this.coverageAnalyzer = coverageAnalyzer;
    }

    public PipelineResult run(RunParameters parameters, List<Facility> directory, LocalDate today) {
        parameters.validate();
        PipelineStats stats = new PipelineStats();

        List<RawCourseRecord> records = fetchAll(parameters, stats);
        List<ClassifiedCourse> swimCourses = classify(records, stats);
        List<ExpandedCourse> expanded = expand(swimCourses, today, parameters.getWeeksAhead(), stats);
        List<CanonicalSession> resolved = resolve(expanded, directory, parameters.getMatchThreshold(), stats);
        List<CanonicalSession> sessions = collapseDuplicates(resolved);
        stats.setSessionsGenerated(sessions.size());
        log.info("{} sessions generated ({} before collapsing duplicates)", sessions.size(), resolved.size());

        List<ConflictRecord> conflicts;
        if (parameters.isOptimize()) {
            ConflictDetector.Resolution resolution = conflictDetector.optimize(sessions);
            conflicts = resolution.conflicts();
            sessions = resolution.kept();
            stats.setConflictsResolved(resolution.removed());
        } else {
            conflicts = conflictDetector.detect(sessions);
        }
        stats.setConflictsDetected(conflicts.size());

        return PipelineResult.builder()
                .sessions(sessions)
                .stats(stats)
                .qualityReport(qualityReporter.report(sessions, today))
                .coverage(coverageAnalyzer.analyze(sessions))
                .conflicts(conflicts)
                .build();
    }

    // ── Fetch ────────────────────────────────────────────────────────────────

    List<RawCourseRecord> fetchAll(RunParameters parameters, PipelineStats stats) {
        List<SourceAdapter> enabled = adapters.stream().filter(SourceAdapter::isEnabled).toList();
        if (enabled.isEmpty()) {
            throw new PipelineAbortedException("No source adapters are enabled");
        }

        List<CompletableFuture<List<RawCourseRecord>>> futures = enabled.stream()
                .map(adapter -> CompletableFuture.supplyAsync(() -> adapter.fetch(parameters), fetchExecutor))
                .toList();

        List<RawCourseRecord> records = new ArrayList<>();
        int failedEmpty = 0;
        int failures = 0;
        for (int i = 0; i < enabled.size(); i++) {
            List<RawCourseRecord> fetched = futures.get(i).join();
            int adapterFailures = enabled.get(i).drainFailures();
            failures += adapterFailures;
            if (adapterFailures > 0 && fetched.isEmpty()) failedEmpty++;
            records.addAll(fetched);
        }
        stats.setSourceFailures(failures);
        stats.setTotalPrograms(records.size());

        if (failedEmpty == enabled.size()) {
            throw new PipelineAbortedException("All " + enabled.size() + " sources failed, nothing to reconcile");
        }
        log.info("Fetched {} program records from {} sources ({} failures)", records.size(), enabled.size(), failures);
        return records;
    }

    // ── Classify / expand ────────────────────────────────────────────────────

    List<ClassifiedCourse> classify(List<RawCourseRecord> records, PipelineStats stats) {
        List<ClassifiedCourse> swim = new ArrayList<>();
        for (RawCourseRecord record : records) {
            ClassificationResult result = classifier.classify(record);
            if (result.isSwim()) {
                swim.add(new ClassifiedCourse(record, result));
            }
        }
        stats.setSwimPrograms(swim.size());
        stats.setNonSwimSkipped(records.size() - swim.size());
        log.info("Filtered to {} swim programs from {} total", swim.size(), records.size());
        return swim;
    }

    /** Sessions expanded from one program, with the location reference they will be resolved by. */
    record ExpandedCourse(LocationRef location, List<CanonicalSession> sessions) {}

    List<ExpandedCourse> expand(List<ClassifiedCourse> courses, LocalDate today, int weeksAhead,
                                PipelineStats stats) {
        List<ExpandedCourse> expanded = new ArrayList<>();
        int errors = 0;
        for (ClassifiedCourse course : courses) {
            try {
                List<CanonicalSession> sessions = expander.expand(course, today, weeksAhead);
                expanded.add(new ExpandedCourse(LocationRef.of(course.getRecord()), sessions));
            } catch (UnparsableScheduleException e) {
                errors++;
                log.debug("Could not expand '{}': {}", course.getRecord().getTitle(), e.getMessage());
            }
        }
        stats.setParsingErrors(errors);
        if (errors > 0) {
            log.info("{} programs had unparsable schedules", errors);
        }
        return expanded;
    }

    // ── Resolve / identity ───────────────────────────────────────────────────

    /**
     * Resolves each distinct location once per run and stamps the match and content hash
     * onto its sessions. Unmatched sessions keep a null facility id and no hash.
     */
    List<CanonicalSession> resolve(List<ExpandedCourse> courses, List<Facility> directory, double threshold,
                                   PipelineStats stats) {
        Map<LocationRef, Optional<MatchResult>> byLocation = new HashMap<>();
        List<CanonicalSession> out = new ArrayList<>();

        for (ExpandedCourse course : courses) {
            Optional<MatchResult> match = course.location().name() == null
                    ? Optional.empty()
                    : byLocation.computeIfAbsent(course.location(),
                            location -> resolver.resolve(location, directory, threshold));
            for (CanonicalSession session : course.sessions()) {
                out.add(match.map(m -> SessionIdentity.assign(session, m)).orElse(session));
            }
        }

        long matched = byLocation.values().stream().filter(Optional::isPresent).count();
        stats.setFacilitiesMatched((int) matched);
        stats.setFacilitiesUnmatched(byLocation.size() - (int) matched);
        log.info("Facilities: {} matched, {} unmatched", matched, byLocation.size() - matched);
        return out;
    }

    /**
     * Collapses sessions describing the same event, keeping the first. Resolved sessions are
     * keyed by content hash, unresolved ones by location label plus the same fields.
     */
    static List<CanonicalSession> collapseDuplicates(List<CanonicalSession> sessions) {
        Map<String, CanonicalSession> unique = new LinkedHashMap<>();
        for (CanonicalSession s : sessions) {
            String key = s.isResolved()
                    ? s.getContentHash()
                    : "unresolved:" + s.getLocationName() + ":" + s.getDate() + ":" + s.getStartTime() + ":" + s.getSwimType();
            unique.putIfAbsent(key, s);
        }
        return new ArrayList<>(unique.values());
    }
}
