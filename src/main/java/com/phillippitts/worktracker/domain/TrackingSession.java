package com.phillippitts.worktracker.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a work session at one site.
 *
 * <p>The compact constructor enforces the lifecycle invariants, so a store can never hold a
 * session that violates them:
 * <ul>
 *   <li>{@code clockOut} is set if and only if the state is COMPLETED</li>
 *   <li>{@code pendingExitAt} is set if and only if the state is PENDING_EXIT</li>
 *   <li>{@code durationMinutes} is set only when completed, and is never negative</li>
 * </ul>
 *
 * @param id              session id
 * @param siteId          site the session belongs to
 * @param clockIn         start of work
 * @param clockOut        end of work, {@code null} while open
 * @param trackingMethod  AUTO or MANUAL
 * @param state           lifecycle state
 * @param pendingExitAt   when the unconfirmed exit was observed, {@code null} unless PENDING_EXIT
 * @param checkinAccuracy accuracy of the enter transition, if reported
 * @param exitAccuracy    accuracy of the exit transition or confirming sample, if reported
 * @param durationMinutes rounded minutes between clock-in and clock-out, {@code null} while open
 * @param exitResolution  how the session was closed, {@code null} while open
 * @param shortSession    whether the completed duration fell below the minimum-duration floor
 * @param createdAt       creation time
 * @param updatedAt       last modification time
 */
public record TrackingSession(
        String id,
        String siteId,
        Instant clockIn,
        Instant clockOut,
        TrackingMethod trackingMethod,
        SessionState state,
        Instant pendingExitAt,
        Double checkinAccuracy,
        Double exitAccuracy,
        Long durationMinutes,
        ExitResolution exitResolution,
        boolean shortSession,
        Instant createdAt,
        Instant updatedAt
) {

    public TrackingSession {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(clockIn, "clockIn must not be null");
        Objects.requireNonNull(trackingMethod, "trackingMethod must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");

        boolean completed = state == SessionState.COMPLETED;
        if ((clockOut != null) != completed) {
            throw new IllegalStateException("clockOut must be set iff state is COMPLETED (state=" + state + ")");
        }
        if ((pendingExitAt != null) != (state == SessionState.PENDING_EXIT)) {
            throw new IllegalStateException(
                    "pendingExitAt must be set iff state is PENDING_EXIT (state=" + state + ")");
        }
        if (!completed && (durationMinutes != null || exitResolution != null || shortSession)) {
            throw new IllegalStateException("open session cannot carry completion fields");
        }
        if (completed && (durationMinutes == null || durationMinutes < 0)) {
            throw new IllegalStateException("completed session needs a non-negative duration");
        }
        if (completed && clockOut.isBefore(clockIn)) {
            throw new IllegalStateException("clockOut precedes clockIn");
        }
    }

    public boolean isOpen() {
        return state.isOpen();
    }

    public boolean isPendingExit() {
        return state == SessionState.PENDING_EXIT;
    }
}
