package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.config.ReconcilerProperties;
import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator-maintained name → facility id table, tried after scored matching fails.
 * Entries pointing at ids missing from the directory snapshot are ignored.
 */
@Component
@Order(2)
@Slf4j
public class ManualOverrideMatcher implements FacilityMatcher {

    static final String STRATEGY = "manual-override";

    private final Map<String, String> overrides = new HashMap<>();

    @Autowired
    public ManualOverrideMatcher(ReconcilerProperties properties) {
        this(properties.getMatching().getManualOverrides());
    }

    public ManualOverrideMatcher(Map<String, String> overrides) {
        overrides.forEach((name, id) -> this.overrides.put(FacilityNameNormalizer.normalize(name), id));
    }

    @Override
    public Optional<MatchResult> match(LocationRef location, List<Facility> directory, double threshold) {
        if (location == null || location.name() == null || overrides.isEmpty()) {
            return Optional.empty();
        }
        String facilityId = overrides.get(FacilityNameNormalizer.normalize(location.name()));
        if (facilityId == null) {
            return Optional.empty();
        }
        boolean known = directory.stream().anyMatch(f -> facilityId.equals(f.getFacilityId()));
        if (!known) {
            log.warn("Manual override for '{}' points at unknown facility {}", location.name(), facilityId);
            return Optional.empty();
        }
        return Optional.of(new MatchResult(facilityId, 1.0, STRATEGY));
    }
}
