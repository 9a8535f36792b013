package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-signal facility matching. Signals add up toward a score in [0,1]:
 * <pre>
 *   exact case-insensitive name        → 1.0, short-circuits
 *   Jaccard over normalised name words  × 0.50
 *   name containment, either direction  + 0.30
 *   address containment                 + 0.15
 *   postal code equality                + 0.40
 * </pre>
 * Facilities are ranked on the uncapped sum, so a strong partial match never ties with an exact
 * name further down the directory. The best one wins only if it reaches the threshold.
 */
@Component
@Order(1)
@Slf4j
public class ScoredFacilityMatcher implements FacilityMatcher {

    static final String STRATEGY = "scored";

    static final double JACCARD_WEIGHT = 0.5;
    static final double CONTAINMENT_WEIGHT = 0.3;
    static final double ADDRESS_WEIGHT = 0.15;
    static final double POSTAL_CODE_WEIGHT = 0.4;

    @Override
    public Optional<MatchResult> match(LocationRef location, List<Facility> directory, double threshold) {
        if (location == null || isBlank(location.name())) {
            return Optional.empty();
        }

        Facility best = null;
        double bestScore = 0.0;
        for (Facility facility : directory) {
            if (exactName(location, facility)) {
                return Optional.of(new MatchResult(facility.getFacilityId(), 1.0, STRATEGY));
            }
            double score = signalScore(location, facility);
            if (score > bestScore) {
                bestScore = score;
                best = facility;
            }
        }

        if (best != null && bestScore >= threshold) {
            log.debug("Matched '{}' to {} with score {}", location.name(), best.getFacilityId(),
                    String.format("%.2f", bestScore));
            return Optional.of(new MatchResult(best.getFacilityId(), Math.min(1.0, bestScore), STRATEGY));
        }
        log.debug("No confident match for '{}' (best score: {})", location.name(), String.format("%.2f", bestScore));
        return Optional.empty();
    }

    public static double scoreMatch(LocationRef location, Facility facility) {
        if (exactName(location, facility)) return 1.0;
        return Math.min(1.0, signalScore(location, facility));
    }

    static boolean exactName(LocationRef location, Facility facility) {
        if (facility.getName() == null || location.name() == null) return false;
        String rawLocation = location.name().trim().toLowerCase(Locale.ROOT);
        return !rawLocation.isEmpty() && rawLocation.equals(facility.getName().trim().toLowerCase(Locale.ROOT));
    }

    /** Sum of the partial signals, not capped at 1. */
    static double signalScore(LocationRef location, Facility facility) {
        if (facility.getName() == null || location.name() == null) return 0.0;

        String locName = FacilityNameNormalizer.normalize(location.name());
        String facName = FacilityNameNormalizer.normalize(facility.getName());

        double score = JACCARD_WEIGHT * jaccard(FacilityNameNormalizer.words(locName),
                FacilityNameNormalizer.words(facName));

        if (!locName.isEmpty() && !facName.isEmpty()
                && (locName.contains(facName) || facName.contains(locName))) {
            score += CONTAINMENT_WEIGHT;
        }

        if (!isBlank(location.address()) && !isBlank(facility.getAddress())) {
            String a = location.address().trim().toLowerCase(Locale.ROOT);
            String b = facility.getAddress().trim().toLowerCase(Locale.ROOT);
            if (a.contains(b) || b.contains(a)) {
                score += ADDRESS_WEIGHT;
            }
        }

        String locPostal = FacilityNameNormalizer.postalCode(location.postalCode());
        if (!locPostal.isEmpty() && locPostal.equals(FacilityNameNormalizer.postalCode(facility.getPostalCode()))) {
            score += POSTAL_CODE_WEIGHT;
        }

        return score;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
