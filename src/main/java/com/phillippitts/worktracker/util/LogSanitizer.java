package com.phillippitts.worktracker.util;

import java.util.Locale;

/** Utility for privacy-safe logging of positions. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Formats a coordinate pair rounded to two decimals (roughly 1 km), or "n/a" when missing.
     * Exact worker positions never reach the logs.
     */
    public static String coarse(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.2f,%.2f", latitude, longitude);
    }

    /**
     * Formats an accuracy value for logs, or "n/a" when missing.
     */
    public static String accuracy(Double meters) {
        if (meters == null) {
            return "n/a";
        }
        return String.format(Locale.ROOT, "%.0fm", meters);
    }
}
