package com.poolintel.schedule.model;

/**
 * Canonical swim session categories.
 * OTHER is used for pool programs that are swim-related but fit none of the named types.
 */
public enum SwimType {
    LANE_SWIM,
    AQUAFIT,
    RECREATIONAL,
    ADULT_SWIM,
    SENIOR_SWIM,
    OTHER
}
