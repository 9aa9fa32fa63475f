package com.phillippitts.worktracker.service.site;

/**
 * Caller-supplied site attributes for create and update.
 *
 * @param name         display name, required
 * @param latitude     centre latitude
 * @param longitude    centre longitude
 * @param radiusMeters monitored radius; {@code null} means the configured default
 * @param active       whether to monitor; {@code null} means {@code true}
 */
public record SiteDraft(
        String name,
        double latitude,
        double longitude,
        Double radiusMeters,
        Boolean active
) {
}
