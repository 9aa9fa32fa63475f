package com.phillippitts.worktracker.exception;

/**
 * Thrown when a raw transition payload from the location source cannot be validated
 * into an enter/exit transition.
 */
public class InvalidTransitionException extends WorkTrackerException {

    private final String reason;

    public InvalidTransitionException(String reason) {
        super("Invalid transition payload: " + reason);
        this.reason = reason;
    }

    public InvalidTransitionException(String reason, Throwable cause) {
        super("Invalid transition payload: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
