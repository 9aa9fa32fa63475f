package com.phillippitts.worktracker.exception;

/**
 * Thrown when a site definition violates configured bounds (radius, coordinates, name).
 */
public class InvalidSiteException extends WorkTrackerException {

    private final String reason;

    public InvalidSiteException(String reason) {
        super("Invalid site: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
