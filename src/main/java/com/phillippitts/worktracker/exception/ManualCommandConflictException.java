package com.phillippitts.worktracker.exception;

/**
 * Thrown when a manual clock-in or clock-out cannot be applied to the current session state.
 * The command is rejected as a whole; no state changes.
 */
public class ManualCommandConflictException extends WorkTrackerException {

    public enum Reason {
        /** Clock-in requested while the site already has an open session. */
        ALREADY_ACTIVE,
        /** Clock-out requested while the site has no open session. */
        NO_ACTIVE_SESSION
    }

    private final String siteId;
    private final Reason reason;

    public ManualCommandConflictException(String siteId, Reason reason) {
        super(describe(siteId, reason));
        this.siteId = siteId;
        this.reason = reason;
    }

    public String getSiteId() {
        return siteId;
    }

    public Reason getReason() {
        return reason;
    }

    private static String describe(String siteId, Reason reason) {
        return switch (reason) {
            case ALREADY_ACTIVE -> "Already clocked in at site " + siteId;
            case NO_ACTIVE_SESSION -> "No active session at site " + siteId;
        };
    }
}
