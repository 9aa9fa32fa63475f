package com.phillippitts.worktracker.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A single device position reading.
 *
 * @param latitude  WGS84 latitude in degrees
 * @param longitude WGS84 longitude in degrees
 * @param accuracy  horizontal accuracy radius in meters, or {@code null} when the source did not report one
 * @param timestamp when the reading was taken
 */
public record PositionSample(
        double latitude,
        double longitude,
        Double accuracy,
        Instant timestamp
) {

    public PositionSample {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
