package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.IssueType;
import com.poolintel.schedule.model.QualityReport;
import com.poolintel.schedule.model.ValidationIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates {@link SessionValidator} output for a batch into a {@link QualityReport}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QualityReporter {

    static final double QUALITY_THRESHOLD = 0.9;
    static final double MISSING_DATA_THRESHOLD = 0.1;

    private final SessionValidator validator;

    public QualityReport report(List<CanonicalSession> sessions, LocalDate today) {
        Map<String, Integer> issuesByType = new LinkedHashMap<>();
        int valid = 0;

        for (CanonicalSession session : sessions) {
            List<ValidationIssue> issues = validator.validate(session, today);
            if (issues.isEmpty()) {
                valid++;
                continue;
            }
            for (ValidationIssue issue : issues) {
                issuesByType.merge(issue.type().key(), 1, Integer::sum);
            }
        }

        int total = sessions.size();
        double score = total == 0 ? 0.0 : (double) valid / total;

        QualityReport report = QualityReport.builder()
                .totalSessions(total)
                .validSessions(valid)
                .invalidSessions(total - valid)
                .issuesByType(issuesByType)
                .qualityScore(score)
                .recommendations(recommendations(total, score, issuesByType))
                .build();

        log.info("Quality: {}/{} valid (score {}), issues {}", valid, total,
                String.format("%.2f", score), issuesByType);
        return report;
    }

    private List<String> recommendations(int total, double score, Map<String, Integer> issuesByType) {
        List<String> recommendations = new ArrayList<>();
        if (total == 0) return recommendations;

        if (score < QUALITY_THRESHOLD) {
            recommendations.add("Data quality is below 90%. Review parsing logic.");
        }
        int missing = issuesByType.getOrDefault(IssueType.MISSING_DATA.key(), 0);
        if (missing > total * MISSING_DATA_THRESHOLD) {
            recommendations.add("High rate of missing data. Check source data completeness.");
        }
        if (issuesByType.getOrDefault(IssueType.TIME_VALIDATION.key(), 0) > 0) {
            recommendations.add("Time validation errors detected. Review time parsing logic.");
        }
        if (issuesByType.getOrDefault(IssueType.DATE_VALIDATION.key(), 0) > 0) {
            recommendations.add("Sessions outside the accepted date window. Check source date ranges.");
        }
        return recommendations;
    }
}
