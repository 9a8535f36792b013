package com.poolintel.schedule.model;

public record ValidationIssue(IssueType type, String message) {}
