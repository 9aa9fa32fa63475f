package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.domain.TrackingMethod;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.domain.TransitionType;
import com.phillippitts.worktracker.exception.ManualCommandConflictException;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.exception.SiteNotFoundException;
import com.phillippitts.worktracker.service.confidence.ConfidenceEvaluator;
import com.phillippitts.worktracker.service.debounce.DebounceDecision;
import com.phillippitts.worktracker.service.debounce.EventDebouncer;
import com.phillippitts.worktracker.service.metrics.TrackingMetrics;
import com.phillippitts.worktracker.service.notification.AsyncNotificationPublisher;
import com.phillippitts.worktracker.service.notification.NotificationKind;
import com.phillippitts.worktracker.service.site.SiteRepository;
import com.phillippitts.worktracker.service.store.NewSession;
import com.phillippitts.worktracker.service.store.SessionPatch;
import com.phillippitts.worktracker.service.store.TrackingStore;
import com.phillippitts.worktracker.service.tracking.event.SessionTransitionEvent;
import com.phillippitts.worktracker.service.tracking.event.TransitionIgnoredEvent;
import com.phillippitts.worktracker.service.verification.ExitVerificationScheduler;
import com.phillippitts.worktracker.service.verification.event.ExitVerificationCompletedEvent;
import com.phillippitts.worktracker.util.LogSanitizer;
import com.phillippitts.worktracker.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the per-site session lifecycle: ACTIVE → PENDING_EXIT → COMPLETED.
 *
 * <p>Inputs are location transitions, manual clock-in/out commands and verification verdicts.
 * All inputs for one site are serialized under a per-site lock, so an exit, an enter and a
 * verification verdict for the same site never interleave. Different sites proceed in parallel.
 *
 * <p><b>Write-then-act:</b> every change is written to the {@link TrackingStore} first; only after
 * the write returns are timers touched, metrics counted, notifications sent and events published.
 * A failed write propagates to the caller and leaves the previous state in place, so the same
 * input can be retried.
 *
 * <p>Exit handling:
 * <ul>
 *   <li>high-confidence exit → COMPLETED immediately</li>
 *   <li>otherwise → PENDING_EXIT, confirmed or refuted by {@link ExitVerificationScheduler}</li>
 *   <li>enter while pending, inside the verification window → back to ACTIVE, same session</li>
 *   <li>enter while pending, after the window → pending session completed, new session opened</li>
 * </ul>
 */
@Service
public class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    private final TrackingStore store;
    private final EventDebouncer debouncer;
    private final ConfidenceEvaluator evaluator;
    private final ExitVerificationScheduler verifier;
    private final SiteRepository sites;
    private final AsyncNotificationPublisher notifications;
    private final ApplicationEventPublisher publisher;
    private final TrackingMetrics metrics;
    private final Clock clock;

    private final double poorAccuracyMeters;
    private final double degradationFactor;
    private final long minimumSessionMinutes;
    private final Duration verificationWindow;

    private final ConcurrentMap<String, ReentrantLock> siteLocks = new ConcurrentHashMap<>();

    public SessionStateMachine(TrackingStore store,
                               EventDebouncer debouncer,
                               ConfidenceEvaluator evaluator,
                               ExitVerificationScheduler verifier,
                               SiteRepository sites,
                               AsyncNotificationPublisher notifications,
                               ApplicationEventPublisher publisher,
                               TrackingMetrics metrics,
                               Clock clock,
                               TrackingProperties props) {
        this.store = Objects.requireNonNull(store, "store");
        this.debouncer = Objects.requireNonNull(debouncer, "debouncer");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.sites = Objects.requireNonNull(sites, "sites");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(props, "props");
        this.poorAccuracyMeters = props.getPoorAccuracyMeters();
        this.degradationFactor = props.getDegradationFactor();
        this.minimumSessionMinutes = props.getMinimumSessionMinutes();
        this.verificationWindow = props.getMaxVerificationWindow();
    }

    /**
     * Applies one location transition.
     *
     * <p>After the site's lock is released, pending exits that outlived their verification
     * window are swept (see {@link #reconcilePendingExits()}). A store failure during that sweep
     * is logged and never reported as a failure of this transition, which is already committed.
     *
     * @param transition validated transition
     * @return what happened
     * @throws SiteNotFoundException if the site is unknown
     * @throws com.phillippitts.worktracker.exception.PersistenceException if a store write fails
     */
    public TransitionOutcome handleTransition(LocationTransition transition) {
        Site site = requireSite(transition.siteId());
        TransitionOutcome outcome = withSiteLock(site.id(), () -> {
            LOG.info("Transition {} at {} accuracy={} coords={}", transition.type(), transition.timestamp(),
                    LogSanitizer.accuracy(transition.accuracy()),
                    LogSanitizer.coarse(transition.latitude(), transition.longitude()));
            DebounceDecision decision = debouncer.check(transition);
            if (!decision.accepted()) {
                return ignoredWithoutRecord(transition, IgnoreReason.DEBOUNCED);
            }
            return transition.type() == TransitionType.ENTER
                    ? applyEnter(transition, site)
                    : applyExit(transition, site);
        });
        sweepAfterTransition(site.id());
        return outcome;
    }

    /**
     * Opens a MANUAL session at the current time.
     *
     * @throws ManualCommandConflictException if the site already has an open session
     */
    public TrackingSession clockIn(String siteId) {
        Site site = requireSite(siteId);
        return withSiteLock(siteId, () -> {
            Optional<TrackingSession> open = store.getActiveOrPendingSession(siteId);
            if (open.isPresent()) {
                throw new ManualCommandConflictException(siteId, ManualCommandConflictException.Reason.ALREADY_ACTIVE);
            }
            TrackingSession created = store.createSession(
                    new NewSession(siteId, clock.instant(), TrackingMethod.MANUAL, null));
            afterOpen(created, site);
            return created;
        });
    }

    /**
     * Completes the site's open session at the current time, cancelling any verification in progress.
     *
     * @throws ManualCommandConflictException if the site has no open session
     */
    public TrackingSession clockOut(String siteId) {
        Site site = requireSite(siteId);
        return withSiteLock(siteId, () -> {
            TrackingSession open = store.getActiveOrPendingSession(siteId).orElseThrow(() ->
                    new ManualCommandConflictException(siteId, ManualCommandConflictException.Reason.NO_ACTIVE_SESSION));
            return complete(open, site, clock.instant(), null, ExitResolution.MANUAL);
        });
    }

    /**
     * Applies a verification verdict. Verdicts for sessions that are no longer pending, or
     * that belong to an earlier pending exit, are dropped.
     */
    @EventListener
    public void onVerificationCompleted(ExitVerificationCompletedEvent event) {
        withSiteLock(event.siteId(), () -> {
            Optional<TrackingSession> current = store.getSession(event.sessionId());
            if (current.isEmpty() || !current.get().isPendingExit()
                    || !event.pendingExitAt().equals(current.get().pendingExitAt())) {
                LOG.debug("Dropping stale verdict {} for session {}", event.verdict(), event.sessionId());
                return null;
            }
            TrackingSession session = current.get();
            Site site = sites.findById(session.siteId()).orElse(null);
            PositionSample sample = event.sample();
            switch (event.verdict()) {
                case CONFIRMED_OUTSIDE -> complete(session, site, sample.timestamp(), sample.accuracy(),
                        ExitResolution.VERIFIED);
                case CONFIRMED_INSIDE -> {
                    TrackingSession reactivated = store.updateSession(session.id(), SessionPatch.reactivate());
                    verifier.cancel(session.id());
                    LOG.info("Exit refuted for session {} (check {}): still on site", session.id(), event.checkNumber());
                    publishTransition(reactivated, SessionState.PENDING_EXIT);
                }
                case EXHAUSTED -> complete(session, site, event.checkDueAt(),
                        sample != null ? sample.accuracy() : null, ExitResolution.EXIT_BY_DEFAULT);
                default -> throw new IllegalStateException("Unhandled verdict: " + event.verdict());
            }
            return null;
        });
    }

    /**
     * Resolves pending exits whose verification can no longer complete.
     *
     * <p>A PENDING_EXIT session is completed as {@link ExitResolution#RECONCILED}, with clock-out at
     * the end of its verification window, once that window has passed and no check is still
     * outstanding. A pending session still inside its window without live checks (typically after
     * a restart) has its remaining checks scheduled.
     *
     * <p>Sites are reconciled independently: a store failure on one session is logged and the
     * sweep moves on; that session is retried by the next sweep.
     *
     * @return number of sessions completed
     * @throws PersistenceException if the pending sessions cannot be listed
     */
    public int reconcilePendingExits() {
        Instant now = clock.instant();
        int resolved = 0;
        for (TrackingSession candidate : store.findSessionsInState(SessionState.PENDING_EXIT)) {
            if (verifier.hasPendingChecks(candidate.id())) {
                continue;
            }
            try {
                Boolean done = withSiteLock(candidate.siteId(), () -> reconcileOne(candidate.id(), now));
                if (Boolean.TRUE.equals(done)) {
                    resolved++;
                }
            } catch (PersistenceException e) {
                LOG.warn("Could not reconcile pending exit of session {} at site {}; retrying next sweep: {}",
                        candidate.id(), candidate.siteId(), e.getMessage());
            }
        }
        if (resolved > 0) {
            LOG.info("Reconciled {} stale pending exit(s)", resolved);
        }
        return resolved;
    }

    private void sweepAfterTransition(String siteId) {
        try {
            reconcilePendingExits();
        } catch (PersistenceException e) {
            LOG.warn("Pending exit sweep after transition at site {} failed: {}", siteId, e.getMessage());
        }
    }

    private Boolean reconcileOne(String sessionId, Instant now) {
        Optional<TrackingSession> current = store.getSession(sessionId);
        if (current.isEmpty() || !current.get().isPendingExit() || verifier.hasPendingChecks(sessionId)) {
            return false;
        }
        TrackingSession session = current.get();
        Site site = sites.findById(session.siteId()).orElse(null);
        Instant windowEnd = session.pendingExitAt().plus(verificationWindow);
        if (now.isBefore(windowEnd)) {
            LOG.info("Resuming exit verification for session {} (pending since {})",
                    session.id(), session.pendingExitAt());
            verifier.schedule(session, site);
            return false;
        }
        complete(session, site, windowEnd, null, ExitResolution.RECONCILED);
        return true;
    }

    private TransitionOutcome applyEnter(LocationTransition t, Site site) {
        Optional<TrackingSession> open = store.getActiveOrPendingSession(t.siteId());
        if (open.isPresent() && open.get().state() == SessionState.ACTIVE) {
            return ignore(t, IgnoreReason.DUPLICATE, open.get());
        }

        if (open.isPresent()) {
            TrackingSession pending = open.get();
            Instant windowEnd = pending.pendingExitAt().plus(verificationWindow);
            if (!t.timestamp().isAfter(windowEnd)) {
                TrackingSession reactivated = store.updateSession(pending.id(), SessionPatch.reactivate());
                accept(t);
                verifier.cancel(pending.id());
                LOG.info("Re-entry within verification window; session {} active again", pending.id());
                publishTransition(reactivated, SessionState.PENDING_EXIT);
                return TransitionOutcome.applied(t.type(), TransitionOutcome.Action.EXIT_CANCELLED, reactivated);
            }
            complete(pending, site, windowEnd, null, ExitResolution.REENTRY_CONFIRMED);
        }

        TrackingSession created = store.createSession(
                new NewSession(t.siteId(), t.timestamp(), TrackingMethod.AUTO, t.accuracy()));
        accept(t);
        afterOpen(created, site);
        return TransitionOutcome.applied(t.type(), TransitionOutcome.Action.CLOCKED_IN, created);
    }

    private TransitionOutcome applyExit(LocationTransition t, Site site) {
        Optional<TrackingSession> open = store.getActiveOrPendingSession(t.siteId());
        if (open.isEmpty()) {
            return ignore(t, IgnoreReason.NO_SESSION, null);
        }
        TrackingSession session = open.get();
        Double accuracy = t.accuracy();
        if (accuracy != null && accuracy > poorAccuracyMeters) {
            return ignore(t, IgnoreReason.POOR_ACCURACY, session);
        }
        Double checkin = session.checkinAccuracy();
        if (accuracy != null && checkin != null && checkin > 0 && accuracy > checkin * degradationFactor) {
            return ignore(t, IgnoreReason.SIGNAL_DEGRADATION, session);
        }
        if (session.isPendingExit()) {
            return ignore(t, IgnoreReason.DUPLICATE, session);
        }

        if (evaluator.tierOf(accuracy).isHigh()) {
            TrackingSession completed = complete(session, site, t.timestamp(), accuracy, ExitResolution.IMMEDIATE);
            accept(t);
            return TransitionOutcome.applied(t.type(), TransitionOutcome.Action.CLOCKED_OUT, completed);
        }

        TrackingSession pending = store.updateSession(session.id(), SessionPatch.pendingExit(t.timestamp(), accuracy));
        accept(t);
        LOG.info("Exit with {} confidence; session {} pending verification",
                evaluator.tierOf(accuracy), session.id());
        verifier.schedule(pending, site);
        publishTransition(pending, SessionState.ACTIVE);
        return TransitionOutcome.applied(t.type(), TransitionOutcome.Action.EXIT_PENDING, pending);
    }

    private TrackingSession complete(TrackingSession session, Site site, Instant clockOut, Double exitAccuracy,
                                     ExitResolution resolution) {
        Instant effectiveOut = TimeUtils.max(clockOut, session.clockIn());
        long minutes = TimeUtils.roundedMinutesBetween(session.clockIn(), effectiveOut);
        boolean shortSession = minutes < minimumSessionMinutes;

        TrackingSession completed = store.updateSession(session.id(),
                SessionPatch.complete(effectiveOut, exitAccuracy, minutes, resolution, shortSession));
        verifier.cancel(session.id());
        metrics.incrementCompleted(resolution, shortSession);

        String siteName = site != null ? site.name() : session.siteId();
        if (shortSession) {
            LOG.info("Session {} completed ({}) after {} min, below the {} min minimum; flagged short",
                    session.id(), resolution.wireName(), minutes, minimumSessionMinutes);
            notifications.publish(NotificationKind.SHORT_SESSION, session.siteId(),
                    "Short visit at " + siteName + " (" + TimeUtils.formatMinutes(minutes) + ") not counted");
        } else {
            LOG.info("Session {} completed ({}): {} min", session.id(), resolution.wireName(), minutes);
            notifications.publish(NotificationKind.CLOCKED_OUT, session.siteId(),
                    "Clocked out from " + siteName + ". Worked " + TimeUtils.formatMinutes(minutes) + ".");
        }
        publishTransition(completed, session.state());
        return completed;
    }

    private void afterOpen(TrackingSession created, Site site) {
        LOG.info("Session {} opened ({}) at {}", created.id(), created.trackingMethod(), created.clockIn());
        notifications.publish(NotificationKind.CLOCKED_IN, created.siteId(), "Clocked in at " + site.name());
        publishTransition(created, null);
    }

    private void accept(LocationTransition t) {
        store.appendEvent(TransitionEvent.accepted(t));
        debouncer.recordAccepted(t);
        metrics.incrementAccepted(t.type());
    }

    private TransitionOutcome ignore(LocationTransition t, IgnoreReason reason, TrackingSession open) {
        store.appendEvent(TransitionEvent.ignored(t, reason));
        debouncer.recordAccepted(t);
        return ignoredWithoutRecord(t, reason, open);
    }

    private TransitionOutcome ignoredWithoutRecord(LocationTransition t, IgnoreReason reason) {
        return ignoredWithoutRecord(t, reason, store.getActiveOrPendingSession(t.siteId()).orElse(null));
    }

    private TransitionOutcome ignoredWithoutRecord(LocationTransition t, IgnoreReason reason, TrackingSession open) {
        LOG.info("Ignored {} for site {}: {}", t.type(), t.siteId(), reason.wireName());
        metrics.incrementIgnored(t.type(), reason);
        publisher.publishEvent(new TransitionIgnoredEvent(t.siteId(), t.type(), reason, t.timestamp()));
        return TransitionOutcome.ignored(t.siteId(), t.type(), reason, open);
    }

    private void publishTransition(TrackingSession session, SessionState from) {
        publisher.publishEvent(new SessionTransitionEvent(session, from, clock.instant()));
    }

    private Site requireSite(String siteId) {
        return sites.findById(siteId).orElseThrow(() -> new SiteNotFoundException(siteId));
    }

    private <T> T withSiteLock(String siteId, Supplier<T> action) {
        ReentrantLock lock = siteLocks.computeIfAbsent(siteId, id -> new ReentrantLock());
        lock.lock();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("siteId", siteId)) {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
