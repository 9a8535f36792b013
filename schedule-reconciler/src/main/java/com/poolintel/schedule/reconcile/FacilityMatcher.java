package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;

import java.util.List;
import java.util.Optional;

/**
 * One strategy for resolving an upstream location to a directory facility.
 */
public interface FacilityMatcher {

    Optional<MatchResult> match(LocationRef location, List<Facility> directory, double threshold);
}
