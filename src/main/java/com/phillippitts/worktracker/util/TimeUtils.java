package com.phillippitts.worktracker.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time arithmetic shared by the session lifecycle and the query surface.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of milliseconds in one minute.
     */
    public static final long MILLIS_PER_MINUTE = 60_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Whole minutes between two instants, rounded half-up: {@code round((to - from) / 60000)}.
     *
     * <p>Never negative; an end before the start yields 0.
     *
     * @param from start instant
     * @param to   end instant
     * @return rounded minutes, at least 0
     */
    public static long roundedMinutesBetween(Instant from, Instant to) {
        long millis = Duration.between(from, to).toMillis();
        if (millis <= 0) {
            return 0;
        }
        return Math.round((double) millis / MILLIS_PER_MINUTE);
    }

    /**
     * Returns the later of two instants.
     *
     * @param a first instant
     * @param b second instant
     * @return {@code a} if it is not before {@code b}, otherwise {@code b}
     */
    public static Instant max(Instant a, Instant b) {
        return a.isBefore(b) ? b : a;
    }

    /**
     * Whether {@code [start, end)} overlaps {@code [from, to)}. A {@code null} end means open-ended.
     *
     * @param start interval start
     * @param end   interval end, or {@code null} if still running
     * @param from  window start
     * @param to    window end
     * @return {@code true} when the intervals share any instant
     */
    public static boolean overlaps(Instant start, Instant end, Instant from, Instant to) {
        return start.isBefore(to) && (end == null || end.isAfter(from));
    }

    /**
     * Formats a minute count for user-facing text, e.g. {@code "8h 1m"} or {@code "45m"}.
     *
     * @param minutes non-negative minute count
     * @return compact hours/minutes string
     */
    public static String formatMinutes(long minutes) {
        long hours = minutes / 60;
        long rest = minutes % 60;
        return hours > 0 ? hours + "h " + rest + "m" : rest + "m";
    }
}
