package com.poolintel.schedule.model;

import lombok.Builder;
import lombok.Value;

/**
 * Entry of the curated facility directory. Read-only input to the pipeline.
 */
@Value
@Builder
public class Facility {
    String facilityId;
    String name;
    String address;
    String postalCode;
}
