package com.phillippitts.worktracker.service.store;

import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.exception.PersistenceException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract consumed by the tracking engine.
 *
 * <p>The engine contains no storage logic of its own; any engine that honours this contract
 * can be substituted. A write is considered applied only once the method returns normally.
 * Implementations signal failures with {@link PersistenceException} and must leave the prior
 * state intact when they do.
 */
public interface TrackingStore {

    /**
     * Returns the site's ACTIVE or PENDING_EXIT session, if any.
     */
    Optional<TrackingSession> getActiveOrPendingSession(String siteId);

    /**
     * Opens a session in state ACTIVE.
     *
     * @throws PersistenceException if the site already has an open session or the write fails
     */
    TrackingSession createSession(NewSession session);

    /**
     * Applies a lifecycle patch.
     *
     * @return the stored snapshot after the patch
     * @throws PersistenceException if the session does not exist, the patch is invalid or the write fails
     */
    TrackingSession updateSession(String id, SessionPatch patch);

    /**
     * Appends an audit record. Events are never modified afterwards.
     */
    TransitionEvent appendEvent(TransitionEvent event);

    /**
     * Most recent sessions for a site, newest clock-in first.
     */
    List<TrackingSession> queryHistory(String siteId, int limit);

    Optional<TrackingSession> getSession(String id);

    /**
     * All sessions currently in the given state, oldest clock-in first.
     */
    List<TrackingSession> findSessionsInState(SessionState state);

    /**
     * Sessions whose {@code [clockIn, clockOut)} overlaps {@code [from, to)}; open sessions count as
     * running until now. Oldest clock-in first.
     */
    List<TrackingSession> findSessionsOverlapping(Instant from, Instant to);

    /**
     * Latest event for the site that passed the debouncer, used to rebuild debounce state on cold start.
     */
    Optional<TransitionEvent> findLastAcceptedEvent(String siteId);

    /**
     * Most recent audit events for a site, newest first.
     */
    List<TransitionEvent> queryEvents(String siteId, int limit);
}
