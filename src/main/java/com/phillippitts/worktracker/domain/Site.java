package com.phillippitts.worktracker.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A named circular region monitored for entry and exit.
 *
 * @param id           site id, also used as the platform monitor identifier
 * @param name         display name
 * @param latitude     centre latitude
 * @param longitude    centre longitude
 * @param radiusMeters monitored radius; bounds are enforced by {@code SiteService}
 * @param active       whether the site is currently monitored
 * @param createdAt    creation time
 * @param updatedAt    last modification time
 */
public record Site(
        String id,
        String name,
        double latitude,
        double longitude,
        double radiusMeters,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {

    public Site {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("radiusMeters must be positive, got: " + radiusMeters);
        }
    }
}
