package com.poolintel.schedule.model;

/**
 * Upstream location reference to be resolved against the facility directory.
 * Any field may be blank.
 */
public record LocationRef(String name, String address, String postalCode) {

    public static LocationRef of(RawCourseRecord record) {
        return new LocationRef(record.getLocationName(), record.getAddress(), record.getPostalCode());
    }
}
