package com.poolintel.schedule.reconcile;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Name and postal-code normalisation for facility matching.
 * At most one suffix is stripped per name so "Pool and Arena" style names keep their core words.
 */
public final class FacilityNameNormalizer {

    /** Checked in order; the first suffix that matches is the only one removed. */
    static final List<String> SUFFIXES = List.of(
            " community recreation centre",
            " community recreation center",
            " community centre",
            " community center",
            " community pool",
            " recreation centre",
            " recreation center",
            " aquatic centre",
            " aquatic center",
            " aquatic complex",
            " and pool",
            " pool",
            " arena",
            " recreation"
    );

    private FacilityNameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) return "";
        String lower = name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (String suffix : SUFFIXES) {
            if (lower.endsWith(suffix) && lower.length() > suffix.length()) {
                return lower.substring(0, lower.length() - suffix.length()).trim();
            }
        }
        return lower;
    }

    public static Set<String> words(String normalized) {
        if (normalized == null || normalized.isBlank()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(normalized.split(" ")));
    }

    public static String postalCode(String postalCode) {
        if (postalCode == null) return "";
        return postalCode.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }
}
