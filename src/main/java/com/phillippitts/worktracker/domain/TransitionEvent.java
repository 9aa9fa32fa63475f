package com.phillippitts.worktracker.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Write-once audit record of a transition as it was received.
 *
 * <p>Related to sessions only through {@code siteId} and time; it never owns a session.
 *
 * @param id           unique event id
 * @param siteId       site the transition refers to
 * @param eventType    enter or exit
 * @param timestamp    when the crossing was observed
 * @param latitude     optional latitude
 * @param longitude    optional longitude
 * @param accuracy     optional accuracy in meters
 * @param ignored      whether the engine discarded the event
 * @param ignoreReason why it was discarded, {@link IgnoreReason#NONE} when it was acted upon
 */
public record TransitionEvent(
        String id,
        String siteId,
        TransitionType eventType,
        Instant timestamp,
        Double latitude,
        Double longitude,
        Double accuracy,
        boolean ignored,
        IgnoreReason ignoreReason
) {

    public TransitionEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        ignoreReason = ignoreReason == null ? IgnoreReason.NONE : ignoreReason;
        if (ignored == (ignoreReason == IgnoreReason.NONE)) {
            throw new IllegalArgumentException(
                    "ignored flag and ignoreReason disagree: ignored=" + ignored + ", reason=" + ignoreReason);
        }
    }

    public static TransitionEvent accepted(LocationTransition t) {
        return of(t, IgnoreReason.NONE);
    }

    public static TransitionEvent ignored(LocationTransition t, IgnoreReason reason) {
        if (reason == null || reason == IgnoreReason.NONE) {
            throw new IllegalArgumentException("an ignored event needs a reason");
        }
        return of(t, reason);
    }

    private static TransitionEvent of(LocationTransition t, IgnoreReason reason) {
        return new TransitionEvent(
                UUID.randomUUID().toString(),
                t.siteId(),
                t.type(),
                t.timestamp(),
                t.latitude(),
                t.longitude(),
                t.accuracy(),
                reason != IgnoreReason.NONE,
                reason);
    }

    /**
     * Whether this event passed the debouncer and therefore counts towards the cooldown window.
     *
     * @return {@code false} only for debounced events
     */
    public boolean passedDebounce() {
        return ignoreReason != IgnoreReason.DEBOUNCED;
    }
}
