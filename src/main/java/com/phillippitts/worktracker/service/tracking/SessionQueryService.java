package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.service.store.TrackingStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side of the tracking engine.
 *
 * <p>Reads go straight to the store and never take site locks.
 */
@Service
public class SessionQueryService {

    static final int MAX_LIMIT = 500;

    private final TrackingStore store;

    public SessionQueryService(TrackingStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Sessions overlapping {@code [from, to)}. Completed sessions flagged short are left out;
     * open sessions are included.
     *
     * @throws IllegalArgumentException if {@code to} is not after {@code from}
     */
    public List<TrackingSession> getSessionsOverlapping(Instant from, Instant to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("'to' must be after 'from'");
        }
        return store.findSessionsOverlapping(from, to).stream()
                .filter(s -> !s.shortSession())
                .toList();
    }

    /** The site's ACTIVE or PENDING_EXIT session. */
    public Optional<TrackingSession> getActiveSession(String siteId) {
        return store.getActiveOrPendingSession(siteId);
    }

    /** Most recent sessions, short ones included, newest first. */
    public List<TrackingSession> history(String siteId, int limit) {
        return store.queryHistory(siteId, clamp(limit));
    }

    /** Audit trail of transitions, newest first. */
    public List<TransitionEvent> events(String siteId, int limit) {
        return store.queryEvents(siteId, clamp(limit));
    }

    private static int clamp(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
