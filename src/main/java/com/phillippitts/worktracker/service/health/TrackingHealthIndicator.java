package com.phillippitts.worktracker.service.health;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.service.location.LocationCapability;
import com.phillippitts.worktracker.service.store.TrackingStore;
import com.phillippitts.worktracker.service.verification.ExitVerificationScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Health indicator for the tracking engine.
 *
 * <ul>
 *   <li>UP: store reachable, no pending exit past its verification window</li>
 *   <li>DEGRADED: at least one pending exit outlived its window (reconciliation is behind)</li>
 *   <li>DOWN: store unreachable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class TrackingHealthIndicator implements HealthIndicator {

    private final TrackingStore store;
    private final ExitVerificationScheduler verifier;
    private final LocationCapability location;
    private final Clock clock;
    private final Duration window;

    public TrackingHealthIndicator(TrackingStore store,
                                   ExitVerificationScheduler verifier,
                                   LocationCapability location,
                                   Clock clock,
                                   TrackingProperties props) {
        this.store = store;
        this.verifier = verifier;
        this.location = location;
        this.clock = clock;
        this.window = props.getMaxVerificationWindow();
    }

    @Override
    public Health health() {
        List<TrackingSession> pending;
        try {
            pending = store.findSessionsInState(SessionState.PENDING_EXIT);
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("status", "Tracking store unavailable").build();
        }

        Instant now = clock.instant();
        long stale = pending.stream()
                .filter(s -> now.isAfter(s.pendingExitAt().plus(window)))
                .count();

        Health.Builder builder = stale > 0
                ? new Health.Builder().status("DEGRADED").withDetail("status", "Pending exits awaiting reconciliation")
                : new Health.Builder().up().withDetail("status", "Tracking operational");
        return builder
                .withDetail("monitoredSites", location.monitoredSiteIds().size())
                .withDetail("pendingExits", pending.size())
                .withDetail("stalePendingExits", stale)
                .withDetail("openVerifications", verifier.openEpisodes())
                .build();
    }
}
