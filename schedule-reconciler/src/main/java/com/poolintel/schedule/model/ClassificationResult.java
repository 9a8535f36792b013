package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Outcome of classifying one program. Derived, never persisted.
 */
@Value
@Builder
public class ClassificationResult {

    boolean swim;
    SwimType swimType;

    /** Heuristic certainty in [0,1], not a calibrated probability */
    double confidence;

    Set<String> tags;

    /** null means all ages */
    AgeGroup ageGroup;

    public static ClassificationResult notSwim() {
        return ClassificationResult.builder()
                .swim(false)
                .confidence(0.0)
                .tags(Set.of())
                .build();
    }
}
