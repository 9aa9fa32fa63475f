package com.phillippitts.worktracker.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A validated enter/exit notification from the location transition source.
 *
 * <p>Coordinates and accuracy are optional because platforms frequently omit them.
 *
 * @param siteId    monitored site the transition refers to
 * @param type      enter or exit
 * @param timestamp when the platform observed the crossing
 * @param latitude  optional device latitude
 * @param longitude optional device longitude
 * @param accuracy  optional accuracy in meters
 */
public record LocationTransition(
        String siteId,
        TransitionType type,
        Instant timestamp,
        Double latitude,
        Double longitude,
        Double accuracy
) {

    public LocationTransition {
        Objects.requireNonNull(siteId, "siteId must not be null");
        if (siteId.isBlank()) {
            throw new IllegalArgumentException("siteId must not be blank");
        }
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (accuracy != null && (accuracy.isNaN() || accuracy < 0)) {
            accuracy = null;
        }
    }

    public static LocationTransition enter(String siteId, Instant at, Double accuracy) {
        return new LocationTransition(siteId, TransitionType.ENTER, at, null, null, accuracy);
    }

    public static LocationTransition exit(String siteId, Instant at, Double accuracy) {
        return new LocationTransition(siteId, TransitionType.EXIT, at, null, null, accuracy);
    }

    public boolean hasAccuracy() {
        return accuracy != null;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
