package com.phillippitts.worktracker.service.store;

import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link TrackingStore}.
 *
 * <p>Session writes are serialized by a single {@link ReentrantLock} so the one-open-session-per-site
 * rule is checked and applied atomically. Reads work on the concurrent maps without locking.
 */
@Component
public class InMemoryTrackingStore implements TrackingStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryTrackingStore.class);

    private static final Comparator<TrackingSession> BY_CLOCK_IN = Comparator.comparing(TrackingSession::clockIn);
    private static final Comparator<TransitionEvent> BY_TIMESTAMP = Comparator.comparing(TransitionEvent::timestamp);

    private final Clock clock;
    private final Lock writeLock = new ReentrantLock();
    private final Map<String, TrackingSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, List<TransitionEvent>> eventsBySite = new ConcurrentHashMap<>();

    public InMemoryTrackingStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<TrackingSession> getActiveOrPendingSession(String siteId) {
        return sessions.values().stream()
                .filter(s -> s.siteId().equals(siteId) && s.isOpen())
                .max(BY_CLOCK_IN);
    }

    @Override
    public TrackingSession createSession(NewSession request) {
        writeLock.lock();
        try {
            if (getActiveOrPendingSession(request.siteId()).isPresent()) {
                throw new PersistenceException("createSession",
                        "site " + request.siteId() + " already has an open session");
            }
            Instant now = clock.instant();
            TrackingSession session = new TrackingSession(
                    UUID.randomUUID().toString(),
                    request.siteId(),
                    request.clockIn(),
                    null,
                    request.trackingMethod(),
                    SessionState.ACTIVE,
                    null,
                    request.checkinAccuracy(),
                    null,
                    null,
                    null,
                    false,
                    now,
                    now);
            sessions.put(session.id(), session);
            LOG.debug("Stored new session {} for site {}", session.id(), session.siteId());
            return session;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public TrackingSession updateSession(String id, SessionPatch patch) {
        Objects.requireNonNull(patch, "patch");
        writeLock.lock();
        try {
            TrackingSession current = sessions.get(id);
            if (current == null) {
                throw new PersistenceException("updateSession", "session " + id + " not found");
            }
            TrackingSession updated;
            try {
                updated = patch.applyTo(current, clock.instant());
            } catch (IllegalStateException e) {
                throw new PersistenceException("updateSession",
                        "patch " + patch + " rejected for session " + id, e);
            }
            sessions.put(id, updated);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public TransitionEvent appendEvent(TransitionEvent event) {
        Objects.requireNonNull(event, "event");
        eventsBySite.computeIfAbsent(event.siteId(), k -> new CopyOnWriteArrayList<>()).add(event);
        return event;
    }

    @Override
    public List<TrackingSession> queryHistory(String siteId, int limit) {
        return sessions.values().stream()
                .filter(s -> s.siteId().equals(siteId))
                .sorted(BY_CLOCK_IN.reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public Optional<TrackingSession> getSession(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public List<TrackingSession> findSessionsInState(SessionState state) {
        return sessions.values().stream()
                .filter(s -> s.state() == state)
                .sorted(BY_CLOCK_IN)
                .toList();
    }

    @Override
    public List<TrackingSession> findSessionsOverlapping(Instant from, Instant to) {
        return sessions.values().stream()
                .filter(s -> TimeUtils.overlaps(s.clockIn(), s.clockOut(), from, to))
                .sorted(BY_CLOCK_IN)
                .toList();
    }

    @Override
    public Optional<TransitionEvent> findLastAcceptedEvent(String siteId) {
        return eventsBySite.getOrDefault(siteId, List.of()).stream()
                .filter(TransitionEvent::passedDebounce)
                .max(BY_TIMESTAMP);
    }

    @Override
    public List<TransitionEvent> queryEvents(String siteId, int limit) {
        List<TransitionEvent> events = new ArrayList<>(eventsBySite.getOrDefault(siteId, List.of()));
        events.sort(BY_TIMESTAMP.reversed());
        return events.subList(0, Math.min(Math.max(0, limit), events.size()));
    }
}
