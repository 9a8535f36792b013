package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.IssueType;
import com.poolintel.schedule.model.SwimType;
import com.poolintel.schedule.model.ValidationIssue;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-session checks. All applicable issues are collected; a session is valid iff the list is empty.
 */
@Component
public class SessionValidator {

    private final int pastWindowDays;
    private final int futureWindowDays;
    private final Set<SwimType> acceptedSwimTypes;

    @Autowired
    public SessionValidator(ReconcilerProperties properties) {
        this(properties.getQuality().getPastWindowDays(), properties.getQuality().getFutureWindowDays(),
                EnumSet.allOf(SwimType.class));
    }

    public SessionValidator(int pastWindowDays, int futureWindowDays, Set<SwimType> acceptedSwimTypes) {
        this.pastWindowDays = pastWindowDays;
        this.futureWindowDays = futureWindowDays;
        this.acceptedSwimTypes = acceptedSwimTypes.isEmpty()
                ? EnumSet.noneOf(SwimType.class)
                : EnumSet.copyOf(acceptedSwimTypes);
    }

    public List<ValidationIssue> validate(CanonicalSession session, LocalDate today) {
        List<ValidationIssue> issues = new ArrayList<>();

        // Required fields
        if (isBlank(session.getFacilityId()) && isBlank(session.getLocationName())) {
            issues.add(new ValidationIssue(IssueType.MISSING_DATA, "Missing facility reference"));
        }
        if (session.getDate() == null) {
            issues.add(new ValidationIssue(IssueType.MISSING_DATA, "Missing date"));
        }
        if (session.getStartTime() == null) {
            issues.add(new ValidationIssue(IssueType.MISSING_DATA, "Missing start time"));
        }
        if (session.getEndTime() == null) {
            issues.add(new ValidationIssue(IssueType.MISSING_DATA, "Missing end time"));
        }
        if (session.getSwimType() == null) {
            issues.add(new ValidationIssue(IssueType.MISSING_DATA, "Missing swim type"));
        }

        // Time range
        if (session.getStartTime() != null && session.getEndTime() != null
                && !session.getEndTime().isAfter(session.getStartTime())) {
            issues.add(new ValidationIssue(IssueType.TIME_VALIDATION,
                    "End time " + session.getEndTime() + " is not after start time " + session.getStartTime()));
        }

        // Date window
        if (session.getDate() != null) {
            if (session.getDate().isBefore(today.minusDays(pastWindowDays))) {
                issues.add(new ValidationIssue(IssueType.DATE_VALIDATION,
                        "Date " + session.getDate() + " is more than " + pastWindowDays + " days in the past"));
            } else if (session.getDate().isAfter(today.plusDays(futureWindowDays))) {
                issues.add(new ValidationIssue(IssueType.DATE_VALIDATION,
                        "Date " + session.getDate() + " is more than " + futureWindowDays + " days in the future"));
            }
        }

        if (session.getSwimType() != null && !acceptedSwimTypes.contains(session.getSwimType())) {
            issues.add(new ValidationIssue(IssueType.OTHER, "Invalid swim type: " + session.getSwimType()));
        }

        return issues;
    }

    public boolean isValid(CanonicalSession session, LocalDate today) {
        return validate(session, today).isEmpty();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
