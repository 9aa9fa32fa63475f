package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.service.store.NewSession;
import com.phillippitts.worktracker.service.store.SessionPatch;
import com.phillippitts.worktracker.service.store.TrackingStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating store whose session writes can be made to fail a set number of times.
 */
final class FlakyTrackingStore implements TrackingStore {

    private final TrackingStore delegate;
    final AtomicInteger failCreates = new AtomicInteger();
    final AtomicInteger failUpdates = new AtomicInteger();

    FlakyTrackingStore(TrackingStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<TrackingSession> getActiveOrPendingSession(String siteId) {
        return delegate.getActiveOrPendingSession(siteId);
    }

    @Override
    public TrackingSession createSession(NewSession session) {
        if (failCreates.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new PersistenceException("createSession", "simulated outage");
        }
        return delegate.createSession(session);
    }

    @Override
    public TrackingSession updateSession(String id, SessionPatch patch) {
        if (failUpdates.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new PersistenceException("updateSession", "simulated outage");
        }
        return delegate.updateSession(id, patch);
    }

    @Override
    public TransitionEvent appendEvent(TransitionEvent event) {
        return delegate.appendEvent(event);
    }

    @Override
    public List<TrackingSession> queryHistory(String siteId, int limit) {
        return delegate.queryHistory(siteId, limit);
    }

    @Override
    public Optional<TrackingSession> getSession(String id) {
        return delegate.getSession(id);
    }

    @Override
    public List<TrackingSession> findSessionsInState(SessionState state) {
        return delegate.findSessionsInState(state);
    }

    @Override
    public List<TrackingSession> findSessionsOverlapping(Instant from, Instant to) {
        return delegate.findSessionsOverlapping(from, to);
    }

    @Override
    public Optional<TransitionEvent> findLastAcceptedEvent(String siteId) {
        return delegate.findLastAcceptedEvent(siteId);
    }

    @Override
    public List<TransitionEvent> queryEvents(String siteId, int limit) {
        return delegate.queryEvents(siteId, limit);
    }
}
