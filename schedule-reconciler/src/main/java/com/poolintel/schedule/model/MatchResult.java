package com.poolintel.schedule.model;

/**
 * A facility match with its confidence in [0,1] and the strategy that produced it.
 */
public record MatchResult(String facilityId, double confidence, String strategy) {}
