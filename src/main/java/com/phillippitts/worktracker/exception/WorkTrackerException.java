package com.phillippitts.worktracker.exception;

/**
 * Base exception for all worktracker application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class WorkTrackerException extends RuntimeException {

    public WorkTrackerException(String message) {
        super(message);
    }

    public WorkTrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    public WorkTrackerException(Throwable cause) {
        super(cause);
    }
}
