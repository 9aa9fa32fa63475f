package com.phillippitts.worktracker.service.verification;

/**
 * Final outcome of an exit verification episode.
 */
public enum VerificationVerdict {
    /** A high-confidence sample placed the device outside the site. */
    CONFIRMED_OUTSIDE,
    /** A high-confidence sample placed the device well inside the site. */
    CONFIRMED_INSIDE,
    /** Every scheduled check ran without a confident answer. */
    EXHAUSTED
}
