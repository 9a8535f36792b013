package com.poolintel.schedule.model;

/**
 * Validation issue categories. The key is the name used in the issue histogram.
 */
public enum IssueType {
    MISSING_DATA("missing_data"),
    TIME_VALIDATION("time_validation"),
    DATE_VALIDATION("date_validation"),
    OTHER("other");

    private final String key;

    IssueType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
