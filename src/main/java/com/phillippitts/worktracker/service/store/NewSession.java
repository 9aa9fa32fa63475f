package com.phillippitts.worktracker.service.store;

import com.phillippitts.worktracker.domain.TrackingMethod;

import java.time.Instant;
import java.util.Objects;

/**
 * Values needed to open a session. The store assigns id and audit timestamps.
 *
 * @param siteId          site being clocked in
 * @param clockIn         start of work
 * @param trackingMethod  AUTO or MANUAL
 * @param checkinAccuracy accuracy of the triggering enter, if any
 */
public record NewSession(
        String siteId,
        Instant clockIn,
        TrackingMethod trackingMethod,
        Double checkinAccuracy
) {
    public NewSession {
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(clockIn, "clockIn must not be null");
        Objects.requireNonNull(trackingMethod, "trackingMethod must not be null");
    }
}
