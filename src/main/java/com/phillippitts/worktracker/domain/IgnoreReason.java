package com.phillippitts.worktracker.domain;

import java.util.Locale;

/**
 * Why a transition was recorded but not acted upon.
 */
public enum IgnoreReason {
    NONE,
    /** Exit reported with an accuracy worse than the absolute threshold. */
    POOR_ACCURACY,
    /** Exit accuracy is much worse than the accuracy recorded at check-in. */
    SIGNAL_DEGRADATION,
    /** Exit for a site that has no open session. */
    NO_SESSION,
    /** Arrived inside the cooldown window of the previously accepted event. */
    DEBOUNCED,
    /** Enter while already active, or exit while an exit is already pending. */
    DUPLICATE;

    /**
     * Lower-case name used in logs, metrics tags and API payloads.
     *
     * @return e.g. {@code "no_session"}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
