package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.Facility;
import com.poolintel.schedule.model.LocationRef;
import com.poolintel.schedule.model.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FacilityResolverTest {

    private static final Facility HIGH_PARK = Facility.builder()
            .facilityId("F-100")
            .name("High Park Pool")
            .address("1873 Bloor St W")
            .postalCode("M6R 2Z6")
            .build();

    private static final Facility REGENT_PARK = Facility.builder()
            .facilityId("F-200")
            .name("Regent Park Aquatic Centre")
            .address("640 Dundas St E")
            .postalCode("M5A 2B8")
            .build();

    private static final List<Facility> DIRECTORY = List.of(HIGH_PARK);

    private final ScoredFacilityMatcher scored = new ScoredFacilityMatcher();

    // ── Normalisation ───────────────────────────────────────────────────────

    @Test
    void normalizeStripsOneSuffixOnly() {
        assertThat(FacilityNameNormalizer.normalize("High Park Community Pool")).isEqualTo("high park");
        assertThat(FacilityNameNormalizer.normalize("Regent  Park Aquatic Centre")).isEqualTo("regent park");
        assertThat(FacilityNameNormalizer.normalize("Pool and Arena")).isEqualTo("pool and");
        assertThat(FacilityNameNormalizer.normalize("Pool")).isEqualTo("pool");
        assertThat(FacilityNameNormalizer.postalCode(" m6r 2z6 ")).isEqualTo("M6R2Z6");
    }

    // ── Scored matching ─────────────────────────────────────────────────────

    @Test
    void communityPoolVariantMatchesAboveThreshold() {
        LocationRef location = new LocationRef("High Park Community Pool", null, null);

        assertThat(ScoredFacilityMatcher.scoreMatch(location, HIGH_PARK)).isCloseTo(0.8, within(1e-9));
        Optional<MatchResult> match = scored.match(location, DIRECTORY, 0.6);
        assertThat(match).map(MatchResult::facilityId).contains("F-100");
        assertThat(match.get().confidence()).isGreaterThanOrEqualTo(0.6);
    }

    @Test
    void unrelatedNameIsNeverGuessed() {
        assertThat(scored.match(new LocationRef("Unknown Pool Center", null, null), DIRECTORY, 0.6)).isEmpty();
    }

    @Test
    void exactNameShortCircuits() {
        assertThat(ScoredFacilityMatcher.scoreMatch(new LocationRef("high park pool", null, null), HIGH_PARK))
                .isEqualTo(1.0);
    }

    @Test
    void postalCodeCarriesABorderlineName() {
        LocationRef withoutPostal = new LocationRef("Park High School Pool", null, null);
        LocationRef withPostal = new LocationRef("Park High School Pool", null, "m6r2z6");

        assertThat(scored.match(withoutPostal, DIRECTORY, 0.6)).isEmpty();
        assertThat(scored.match(withPostal, DIRECTORY, 0.6)).map(MatchResult::facilityId).contains("F-100");
    }

    @Test
    void bestScoringFacilityWins() {
        LocationRef location = new LocationRef("Regent Park Pool", "640 Dundas St E, Toronto", null);

        assertThat(scored.match(location, List.of(HIGH_PARK, REGENT_PARK), 0.6))
                .map(MatchResult::facilityId).contains("F-200");
    }

    @Test
    void exactNameBeatsEarlierSiblingWithSameAddress() {
        Facility arena = Facility.builder()
                .facilityId("F-101")
                .name("High Park Arena")
                .address("1873 Bloor St W")
                .postalCode("M6R 2Z6")
                .build();
        LocationRef location = new LocationRef("High Park Pool", "1873 Bloor St W", "M6R 2Z6");

        assertThat(ScoredFacilityMatcher.scoreMatch(location, arena)).isEqualTo(1.0);
        assertThat(scored.match(location, List.of(arena, HIGH_PARK), 0.6))
                .contains(new MatchResult("F-100", 1.0, ScoredFacilityMatcher.STRATEGY));
    }

    @Test
    void strongerUncappedSignalsWinBetweenPartialMatches() {
        Facility postalOnly = Facility.builder()
                .facilityId("F-102")
                .name("High Park Arena")
                .postalCode("M6R 2Z6")
                .build();
        Facility postalAndStreet = Facility.builder()
                .facilityId("F-103")
                .name("High Park Arena")
                .address("1873 Bloor St W")
                .postalCode("M6R 2Z6")
                .build();
        LocationRef location = new LocationRef("High Park Community Pool", "1873 Bloor St W", "M6R 2Z6");

        assertThat(ScoredFacilityMatcher.signalScore(location, postalOnly)).isCloseTo(1.2, within(1e-9));
        assertThat(ScoredFacilityMatcher.signalScore(location, postalAndStreet)).isCloseTo(1.35, within(1e-9));
        Optional<MatchResult> match = scored.match(location, List.of(postalOnly, postalAndStreet), 0.6);
        assertThat(match).map(MatchResult::facilityId).contains("F-103");
        assertThat(match.get().confidence()).isEqualTo(1.0);
    }

    // ── Strategy chain ──────────────────────────────────────────────────────

    @Test
    void manualOverrideIsTriedAfterScoredMatching() {
        ManualOverrideMatcher manual = new ManualOverrideMatcher(Map.of(
                "Unknown Pool Center", "F-100",
                "High Park Community Pool", "F-999"));
        FacilityResolver resolver = new FacilityResolver(List.of(scored, manual));

        Optional<MatchResult> overridden = resolver.resolve(
                new LocationRef("Unknown Pool Center", null, null), DIRECTORY, 0.6);
        assertThat(overridden).contains(new MatchResult("F-100", 1.0, ManualOverrideMatcher.STRATEGY));

        Optional<MatchResult> scoredFirst = resolver.resolve(
                new LocationRef("High Park Community Pool", null, null), DIRECTORY, 0.6);
        assertThat(scoredFirst).map(MatchResult::strategy).contains(ScoredFacilityMatcher.STRATEGY);
    }

    @Test
    void overrideToUnknownFacilityIsIgnored() {
        ManualOverrideMatcher manual = new ManualOverrideMatcher(Map.of("Unknown Pool Center", "F-404"));

        assertThat(manual.match(new LocationRef("Unknown Pool Center", null, null), DIRECTORY, 0.6)).isEmpty();
    }
}
