package com.phillippitts.worktracker.domain;

/** How a session was opened. */
public enum TrackingMethod {
    /** Opened by an accepted geofence enter transition. */
    AUTO,
    /** Opened by an explicit clock-in command. */
    MANUAL
}
