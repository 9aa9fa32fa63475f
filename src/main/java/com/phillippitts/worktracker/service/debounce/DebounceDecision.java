package com.phillippitts.worktracker.service.debounce;

import java.time.Duration;

/**
 * Outcome of a debounce check.
 *
 * @param accepted           whether the transition may proceed
 * @param sinceLastAccepted  time since the previously accepted event for the site, {@code null} if none.
 *                           Negative when the transition is older than that event.
 */
public record DebounceDecision(boolean accepted, Duration sinceLastAccepted) {

    static DebounceDecision accept(Duration sinceLastAccepted) {
        return new DebounceDecision(true, sinceLastAccepted);
    }

    static DebounceDecision reject(Duration sinceLastAccepted) {
        return new DebounceDecision(false, sinceLastAccepted);
    }
}
