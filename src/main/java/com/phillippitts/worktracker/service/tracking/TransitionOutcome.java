package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionType;

import java.util.Objects;

/**
 * What the state machine did with one transition.
 *
 * @param siteId       site of the transition
 * @param type         enter or exit
 * @param action       resulting action
 * @param ignoreReason reason when {@code action == IGNORED}, otherwise {@link IgnoreReason#NONE}
 * @param session      session affected (or, for ignored transitions, the site's open session if any)
 */
public record TransitionOutcome(
        String siteId,
        TransitionType type,
        Action action,
        IgnoreReason ignoreReason,
        TrackingSession session
) {

    public enum Action {
        CLOCKED_IN,
        EXIT_PENDING,
        CLOCKED_OUT,
        EXIT_CANCELLED,
        IGNORED
    }

    public TransitionOutcome {
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(ignoreReason, "ignoreReason must not be null");
        if ((action == Action.IGNORED) == (ignoreReason == IgnoreReason.NONE)) {
            throw new IllegalArgumentException("ignoreReason must be set exactly when the action is IGNORED");
        }
    }

    static TransitionOutcome applied(TransitionType type, Action action, TrackingSession session) {
        return new TransitionOutcome(session.siteId(), type, action, IgnoreReason.NONE, session);
    }

    static TransitionOutcome ignored(String siteId, TransitionType type, IgnoreReason reason, TrackingSession open) {
        return new TransitionOutcome(siteId, type, Action.IGNORED, reason, open);
    }

    public boolean isIgnored() {
        return action == Action.IGNORED;
    }
}
