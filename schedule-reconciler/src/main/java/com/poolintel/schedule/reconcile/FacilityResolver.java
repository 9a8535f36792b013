package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Tries each {@link FacilityMatcher} in order; the first match wins.
 * Unmatched locations are reported, never guessed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FacilityResolver {

    private final List<FacilityMatcher> matchers;

    public Optional<MatchResult> resolve(LocationRef location, List<Facility> directory, double threshold) {
        for (FacilityMatcher matcher : matchers) {
            Optional<MatchResult> result = matcher.match(location, directory, threshold);
            if (result.isPresent()) {
                return result;
            }
        }
        log.warn("No facility match for location '{}'", location == null ? null : location.name());
        return Optional.empty();
    }
}
