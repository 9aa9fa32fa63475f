package com.phillippitts.worktracker.service.events;

import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.service.tracking.event.SessionTransitionEvent;
import com.phillippitts.worktracker.service.tracking.event.TransitionIgnoredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of session changes and ignored transitions.
 *
 * <p>Warnings about degraded location quality are throttled per site and reason to avoid log spam.
 */
@Component
class TrackingEventsListener {
    private static final Logger LOG = LogManager.getLogger(TrackingEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    TrackingEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onSessionTransition(SessionTransitionEvent e) {
        LOG.info("Session {} at site {}: {} -> {}", e.session().id(), e.session().siteId(),
                e.from() == null ? "NEW" : e.from(), e.to());
    }

    @EventListener
    void onTransitionIgnored(TransitionIgnoredEvent e) {
        if (e.reason() != IgnoreReason.POOR_ACCURACY && e.reason() != IgnoreReason.SIGNAL_DEGRADATION) {
            return;
        }
        if (shouldLog(e.siteId() + '-' + e.reason())) {
            LOG.warn("Location quality too low at site {} ({}); exits are being ignored. "
                    + "Check device location permissions and precise-location setting.", e.siteId(), e.reason().wireName());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
