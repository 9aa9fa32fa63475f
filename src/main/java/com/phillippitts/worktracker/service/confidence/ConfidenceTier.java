package com.phillippitts.worktracker.service.confidence;

/**
 * How far a position reading can be trusted for a presence/absence decision.
 */
public enum ConfidenceTier {
    /** Accuracy strictly below the configured threshold. */
    HIGH,
    /** Accuracy reported but at or above the threshold. */
    LOW,
    /** No usable accuracy (missing, NaN or negative). */
    UNKNOWN;

    public boolean isHigh() {
        return this == HIGH;
    }
}
