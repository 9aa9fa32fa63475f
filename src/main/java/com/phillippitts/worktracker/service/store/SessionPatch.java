package com.phillippitts.worktracker.service.store;

import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;

import java.time.Instant;

/**
 * A partial update to a session, expressed as one lifecycle step.
 *
 * <p>Patches are only built through the static factories, so every patch moves a session
 * between two valid states. Applying it still goes through the {@link TrackingSession}
 * constructor, which rejects anything that would break an invariant.
 */
public final class SessionPatch {

    private final SessionState state;
    private final Instant clockOut;
    private final Instant pendingExitAt;
    private final Double exitAccuracy;
    private final boolean exitAccuracySet;
    private final Long durationMinutes;
    private final ExitResolution exitResolution;
    private final boolean shortSession;

    private SessionPatch(SessionState state,
                         Instant clockOut,
                         Instant pendingExitAt,
                         Double exitAccuracy,
                         boolean exitAccuracySet,
                         Long durationMinutes,
                         ExitResolution exitResolution,
                         boolean shortSession) {
        this.state = state;
        this.clockOut = clockOut;
        this.pendingExitAt = pendingExitAt;
        this.exitAccuracy = exitAccuracy;
        this.exitAccuracySet = exitAccuracySet;
        this.durationMinutes = durationMinutes;
        this.exitResolution = exitResolution;
        this.shortSession = shortSession;
    }

    /**
     * ACTIVE → PENDING_EXIT.
     *
     * @param at           when the exit was observed
     * @param exitAccuracy accuracy of the exit transition, may be {@code null}
     */
    public static SessionPatch pendingExit(Instant at, Double exitAccuracy) {
        return new SessionPatch(SessionState.PENDING_EXIT, null, at, exitAccuracy, true, null, null, false);
    }

    /**
     * PENDING_EXIT → ACTIVE. Clears the pending exit and its accuracy; clock-in is untouched.
     */
    public static SessionPatch reactivate() {
        return new SessionPatch(SessionState.ACTIVE, null, null, null, true, null, null, false);
    }

    /**
     * ACTIVE or PENDING_EXIT → COMPLETED.
     *
     * @param clockOut        end of work
     * @param exitAccuracy    accuracy backing the exit; {@code null} keeps the recorded one
     * @param durationMinutes rounded duration
     * @param resolution      how the exit was decided
     * @param shortSession    whether the duration fell below the floor
     */
    public static SessionPatch complete(Instant clockOut,
                                        Double exitAccuracy,
                                        long durationMinutes,
                                        ExitResolution resolution,
                                        boolean shortSession) {
        return new SessionPatch(SessionState.COMPLETED, clockOut, null, exitAccuracy, exitAccuracy != null,
                durationMinutes, resolution, shortSession);
    }

    public SessionState targetState() {
        return state;
    }

    /**
     * Produces the patched snapshot.
     *
     * @param current   session as currently stored
     * @param updatedAt modification timestamp
     * @return new snapshot
     * @throws IllegalStateException if the result would violate a session invariant
     */
    public TrackingSession applyTo(TrackingSession current, Instant updatedAt) {
        return new TrackingSession(
                current.id(),
                current.siteId(),
                current.clockIn(),
                clockOut,
                current.trackingMethod(),
                state,
                pendingExitAt,
                current.checkinAccuracy(),
                exitAccuracySet ? exitAccuracy : current.exitAccuracy(),
                durationMinutes,
                exitResolution,
                shortSession,
                current.createdAt(),
                updatedAt);
    }

    @Override
    public String toString() {
        return "SessionPatch{state=" + state + ", clockOut=" + clockOut + ", pendingExitAt=" + pendingExitAt
                + ", resolution=" + exitResolution + '}';
    }
}
