package com.phillippitts.worktracker.exception;

/**
 * Thrown by a tracking store when a read or write cannot be acknowledged.
 *
 * <p>The engine applies a transition only after the store acknowledged the write, so this
 * exception always leaves the previously persisted state intact and the operation can be retried.
 */
public class PersistenceException extends WorkTrackerException {

    private final String operation;

    public PersistenceException(String operation, String message) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public PersistenceException(String operation, String message, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
