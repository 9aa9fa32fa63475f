package com.phillippitts.worktracker.domain;

/**
 * Lifecycle states of a {@link TrackingSession}.
 *
 * <pre>
 * (none) → ACTIVE → PENDING_EXIT → COMPLETED
 *                 ↖______________↙ (re-entry / confirmed inside)
 * ACTIVE → COMPLETED (immediate high-confidence exit or manual clock-out)
 * </pre>
 */
public enum SessionState {
    ACTIVE,
    PENDING_EXIT,
    COMPLETED;

    /**
     * Returns whether a session in this state still occupies its site.
     *
     * @return {@code true} for ACTIVE and PENDING_EXIT
     */
    public boolean isOpen() {
        return this != COMPLETED;
    }
}
