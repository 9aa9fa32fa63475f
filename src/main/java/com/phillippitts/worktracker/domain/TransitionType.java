package com.phillippitts.worktracker.domain;

/**
 * Closed set of geofence transitions the engine understands.
 *
 * <p>Raw platform payloads are validated into one of these values at the boundary
 * (see {@code GeofencePayloadParser}); nothing inside the core sees an untyped event.
 */
public enum TransitionType {
    ENTER,
    EXIT
}
