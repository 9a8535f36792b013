package com.poolintel.schedule.reconcile;

import com.poolintel.schedule.model.CanonicalSession;
import com.poolintel.schedule.model.MatchResult;
import com.poolintel.schedule.model.SwimType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Content-hash identity for sessions. The hash covers facility, date, start time and swim type;
 * notes, source and end time never change it.
 */
public final class SessionIdentity {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private SessionIdentity() {
    }

    /** Lowercase hex SHA-256 of "facilityId:date:HH:mm:ss:SWIM_TYPE". */
    public static String contentHash(String facilityId, LocalDate date, LocalTime startTime, SwimType swimType) {
        String key = facilityId + ":" + date + ":" + startTime.format(TIME) + ":" + swimType;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String contentHash(CanonicalSession session) {
        return contentHash(session.getFacilityId(), session.getDate(), session.getStartTime(), session.getSwimType());
    }

    /** Attaches the facility match and the resulting hash. */
    public static CanonicalSession assign(CanonicalSession session, MatchResult match) {
        CanonicalSession resolved = session.toBuilder()
                .facilityId(match.facilityId())
                .matchConfidence(match.confidence())
                .build();
        return resolved.toBuilder().contentHash(contentHash(resolved)).build();
    }
}
