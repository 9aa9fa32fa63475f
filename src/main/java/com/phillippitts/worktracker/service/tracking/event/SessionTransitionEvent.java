package com.phillippitts.worktracker.service.tracking.event;

import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a session change has been written to the store.
 *
 * @param session snapshot after the change
 * @param from    previous state, {@code null} for a newly opened session
 * @param at      wall-clock time of the change
 */
public record SessionTransitionEvent(TrackingSession session, SessionState from, Instant at) {

    public SessionTransitionEvent {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }

    public SessionState to() {
        return session.state();
    }
}
