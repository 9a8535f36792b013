package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run knobs: expansion horizon, whether to auto-resolve conflicts, and the
 * minimum facility match score.
 */
@Value
@Builder
public class RunParameters {

    int weeksAhead;
    boolean optimize;
    double matchThreshold;

    /**
     * @throws IllegalArgumentException when the parameters cannot describe a valid run
     */
    public RunParameters validate() {
        if (weeksAhead < 1) {
            throw new IllegalArgumentException("weeksAhead must be at least 1, was " + weeksAhead);
        }
        if (!(matchThreshold > 0.0 && matchThreshold <= 1.0)) {
            throw new IllegalArgumentException("matchThreshold must be in (0, 1], was " + matchThreshold);
        }
        return this;
    }
}
