package com.poolintel.schedule.model;

/**
 * Age group derived from program text. Absence (null) means all ages.
 */
public enum AgeGroup {
    YOUTH,
    ADULT,
    SENIOR,
    FAMILY
}
