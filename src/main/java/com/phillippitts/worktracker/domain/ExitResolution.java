package com.phillippitts.worktracker.domain;

import java.util.Locale;

/**
 * Records how a completed session was closed.
 *
 * <p>{@link #EXIT_BY_DEFAULT} and {@link #RECONCILED} mark sessions whose exit was never
 * positively confirmed by a high-confidence sample.
 */
public enum ExitResolution {
    /** Exit transition carried a high-confidence accuracy. */
    IMMEDIATE,
    /** A verification check saw the device confidently outside the site. */
    VERIFIED,
    /** All verification checks ran without a confident answer. */
    EXIT_BY_DEFAULT,
    /** Resolved after restart (or by the stale sweep) because the verification window had passed. */
    RECONCILED,
    /** A late re-entry found an expired pending exit and closed it before opening a new session. */
    REENTRY_CONFIRMED,
    /** Explicit clock-out command. */
    MANUAL;

    public boolean isUnconfirmed() {
        return this == EXIT_BY_DEFAULT || this == RECONCILED || this == REENTRY_CONFIRMED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
