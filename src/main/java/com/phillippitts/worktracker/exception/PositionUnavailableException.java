package com.phillippitts.worktracker.exception;

/**
 * Thrown by a location capability when an active position fetch fails or no fresh
 * position is known. Verification treats this as a low-confidence sample.
 */
public class PositionUnavailableException extends WorkTrackerException {

    public PositionUnavailableException(String message) {
        super(message);
    }

    public PositionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
