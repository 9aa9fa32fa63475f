package com.phillippitts.worktracker.service.tracking.event;

import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.TransitionType;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a transition is recorded but not acted upon.
 *
 * @param siteId    site of the transition
 * @param type      enter or exit
 * @param reason    why it was ignored
 * @param timestamp transition timestamp
 */
public record TransitionIgnoredEvent(String siteId, TransitionType type, IgnoreReason reason, Instant timestamp) {

    public TransitionIgnoredEvent {
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
