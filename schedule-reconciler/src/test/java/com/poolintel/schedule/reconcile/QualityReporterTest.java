package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.IssueType;
import com.poolintel.schedule.model.QualityReport;
import com.poolintel.schedule.model.SwimType;
import com.poolintel.schedule.model.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QualityReporterTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 11, 3);

    private final SessionValidator validator = new SessionValidator(30, 180, EnumSet.allOf(SwimType.class));
    private final QualityReporter reporter = new QualityReporter(validator);

    @Test
    void oneInvertedRangeInFourScoresThreeQuarters() {
        List<CanonicalSession> sessions = List.of(
                valid().build(),
                valid().startTime(LocalTime.of(12, 0)).endTime(LocalTime.of(13, 0)).build(),
                valid().startTime(LocalTime.of(18, 0)).endTime(LocalTime.of(19, 0)).build(),
                valid().startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(9, 0)).build());

        QualityReport report = reporter.report(sessions, TODAY);

        assertThat(report.getQualityScore()).isEqualTo(0.75);
        assertThat(report.getTotalSessions()).isEqualTo(4);
        assertThat(report.getValidSessions()).isEqualTo(3);
        assertThat(report.getInvalidSessions()).isEqualTo(1);
        assertThat(report.getIssuesByType()).containsEntry("time_validation", 1);
        assertThat(report.getRecommendations()).contains(
                "Data quality is below 90%. Review parsing logic.",
                "Time validation errors detected. Review time parsing logic.");
    }

    @Test
    void cleanBatchHasNoRecommendations() {
        QualityReport report = reporter.report(List.of(valid().build()), TODAY);

        assertThat(report.getQualityScore()).isEqualTo(1.0);
        assertThat(report.getIssuesByType()).isEmpty();
        assertThat(report.getRecommendations()).isEmpty();
    }

    @Test
    void emptyBatchScoresZero() {
        assertThat(reporter.report(List.of(), TODAY).getQualityScore()).isZero();
    }

    @Test
    void allIssuesAreCollected() {
        CanonicalSession broken = CanonicalSession.builder().date(TODAY).build();

        List<ValidationIssue> issues = validator.validate(broken, TODAY);

        assertThat(issues).extracting(ValidationIssue::type)
                .containsOnly(IssueType.MISSING_DATA)
                .hasSize(4);
    }

    @Test
    void dateWindowIsEnforcedBothWays() {
        assertThat(validator.validate(valid().date(TODAY.minusDays(31)).build(), TODAY))
                .extracting(ValidationIssue::type).containsExactly(IssueType.DATE_VALIDATION);
        assertThat(validator.validate(valid().date(TODAY.plusDays(181)).build(), TODAY))
                .extracting(ValidationIssue::type).containsExactly(IssueType.DATE_VALIDATION);
        assertThat(validator.isValid(valid().date(TODAY.minusDays(30)).build(), TODAY)).isTrue();
        assertThat(validator.isValid(valid().date(TODAY.plusDays(180)).build(), TODAY)).isTrue();
    }

    @Test
    void unresolvedSessionWithLocationLabelStillValidates() {
        assertThat(validator.isValid(valid().facilityId(null).build(), TODAY)).isTrue();
    }

    @Test
    void swimTypeOutsideAcceptedSetIsFlagged() {
        SessionValidator strict = new SessionValidator(30, 180, EnumSet.of(SwimType.LANE_SWIM));

        assertThat(strict.validate(valid().swimType(SwimType.OTHER).build(), TODAY))
                .extracting(ValidationIssue::type).containsExactly(IssueType.OTHER);
    }

    @Test
    void highMissingDataRateIsCalledOut() {
        QualityReport report = reporter.report(List.of(
                valid().build(),
                valid().swimType(null).build()), TODAY);

        assertThat(report.getIssuesByType()).containsEntry("missing_data", 1);
        assertThat(report.getRecommendations())
                .contains("High rate of missing data. Check source data completeness.");
    }

    private static CanonicalSession.CanonicalSessionBuilder valid() {
        return CanonicalSession.builder()
                .facilityId("F-100")
                .locationName("High Park Pool")
                .swimType(SwimType.LANE_SWIM)
                .date(TODAY)
                .startTime(LocalTime.of(7, 0))
                .endTime(LocalTime.of(8, 30))
                .source("test");
    }
}
