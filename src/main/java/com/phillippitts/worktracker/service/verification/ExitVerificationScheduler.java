package com.phillippitts.worktracker.service.verification;

import com.phillippitts.worktracker.config.ThreadPoolConfig;
import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.exception.PositionUnavailableException;
import com.phillippitts.worktracker.service.confidence.ConfidenceEvaluator;
import com.phillippitts.worktracker.service.confidence.SampleAssessment;
import com.phillippitts.worktracker.service.location.LocationCapability;
import com.phillippitts.worktracker.service.metrics.TrackingMetrics;
import com.phillippitts.worktracker.service.verification.event.ExitVerificationCompletedEvent;
import com.phillippitts.worktracker.util.LogSanitizer;
import com.phillippitts.worktracker.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Confirms or refutes a low-confidence exit through a short series of active position checks.
 *
 * <p>For a session that entered PENDING_EXIT at {@code t}, one check is scheduled at
 * {@code t + offset} for each configured offset (default 1, 3 and 5 minutes). Each check fetches
 * the current position and grades it against the site:
 * <ul>
 *   <li>high confidence and outside the radius → {@link VerificationVerdict#CONFIRMED_OUTSIDE}</li>
 *   <li>high confidence and well inside → {@link VerificationVerdict#CONFIRMED_INSIDE}</li>
 *   <li>anything else, including a failed fetch → inconclusive; the final check yields
 *       {@link VerificationVerdict#EXHAUSTED}</li>
 * </ul>
 *
 * <p>The verdict is handed to the state machine by publishing an {@link ExitVerificationCompletedEvent}.
 * The episode closes only once that publish returns normally; if the listener fails, the episode
 * remains open for the next check or for reconciliation.
 *
 * <p>Checks run with the ThreadContext of the thread that scheduled them, so they log with the
 * siteId and requestId of the transition that opened the episode.
 *
 * <p>Timers are volatile. After a restart, {@link #schedule(TrackingSession, Site)} resumes a
 * persisted pending exit by scheduling only the checks that are still in the future.
 *
 * <p><b>Thread Safety:</b> checks of one episode are serialized; {@link #cancel(String)} is
 * idempotent and may be called from any thread, including while a check is running.
 */
@Component
public class ExitVerificationScheduler {

    private static final Logger LOG = LogManager.getLogger(ExitVerificationScheduler.class);

    private final TaskScheduler scheduler;
    private final LocationCapability location;
    private final ConfidenceEvaluator evaluator;
    private final ApplicationEventPublisher publisher;
    private final TrackingMetrics metrics;
    private final Clock clock;
    private final List<Duration> offsets;
    private final TaskDecorator contextPropagation = ThreadPoolConfig.mdcPropagatingDecorator();
    private final ConcurrentMap<String, VerificationEpisode> episodes = new ConcurrentHashMap<>();

    public ExitVerificationScheduler(@Qualifier("verificationScheduler") TaskScheduler scheduler,
                                     LocationCapability location,
                                     ConfidenceEvaluator evaluator,
                                     ApplicationEventPublisher publisher,
                                     TrackingMetrics metrics,
                                     Clock clock,
                                     TrackingProperties props) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.location = Objects.requireNonNull(location, "location");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.offsets = Objects.requireNonNull(props, "props").getVerificationOffsets();
        if (offsets.isEmpty()) {
            throw new IllegalArgumentException("At least one verification offset is required");
        }
    }

    /**
     * Starts (or restarts) verification for a PENDING_EXIT session.
     *
     * <p>Any earlier episode for the same session is cancelled first. Checks whose due time has
     * already passed are skipped, except the final one, which then runs immediately.
     *
     * @param session session in PENDING_EXIT
     * @param site    site geometry; {@code null} makes every check inconclusive
     * @throws IllegalArgumentException if the session is not pending exit
     */
    public void schedule(TrackingSession session, Site site) {
        if (!session.isPendingExit()) {
            throw new IllegalArgumentException("Session " + session.id() + " is not pending exit");
        }
        VerificationEpisode episode = new VerificationEpisode(
                session.id(), session.siteId(), site, session.pendingExitAt());
        VerificationEpisode previous = episodes.put(session.id(), episode);
        if (previous != null) {
            previous.close();
        }

        Instant now = clock.instant();
        int scheduled = 0;
        for (int i = 0; i < offsets.size(); i++) {
            int checkNumber = i + 1;
            boolean last = checkNumber == offsets.size();
            Instant dueAt = session.pendingExitAt().plus(offsets.get(i));
            if (dueAt.isBefore(now) && !last) {
                continue;
            }
            Runnable check = contextPropagation.decorate(() -> runCheck(episode, checkNumber, dueAt, last));
            ScheduledFuture<?> timer = scheduler.schedule(check, TimeUtils.max(dueAt, now));
            episode.addTimer(timer);
            scheduled++;
        }
        LOG.info("Scheduled {} exit verification check(s) for session {} (pending since {})",
                scheduled, session.id(), session.pendingExitAt());
    }

    /**
     * Cancels outstanding checks for a session. No-op when nothing is scheduled.
     *
     * @return {@code true} if an open episode was cancelled by this call
     */
    public boolean cancel(String sessionId) {
        VerificationEpisode episode = episodes.remove(sessionId);
        if (episode == null) {
            return false;
        }
        boolean closed = episode.close();
        if (closed) {
            LOG.debug("Cancelled exit verification for session {}", sessionId);
        }
        return closed;
    }

    /**
     * @return {@code true} if the session has checks that have not yet run
     */
    public boolean hasPendingChecks(String sessionId) {
        VerificationEpisode episode = episodes.get(sessionId);
        return episode != null && episode.hasPendingChecks();
    }

    /**
     * @return number of episodes not yet resolved or cancelled
     */
    public int openEpisodes() {
        return episodes.size();
    }

    void runCheck(VerificationEpisode episode, int checkNumber, Instant dueAt, boolean last) {
        episode.checkLock().lock();
        try {
            if (episode.isClosed()) {
                return;
            }
            PositionSample sample = fetchPosition(episode, checkNumber);
            VerificationVerdict verdict = null;
            if (sample != null) {
                episode.recordSample(sample);
                verdict = grade(episode, sample, checkNumber);
            }
            if (verdict == null && last) {
                verdict = VerificationVerdict.EXHAUSTED;
                sample = episode.lastSample();
                LOG.warn("Exit verification for session {} inconclusive after {} check(s); exiting by default",
                        episode.sessionId(), checkNumber);
            }
            if (verdict != null) {
                deliver(episode, verdict, sample, dueAt, checkNumber);
            }
        } finally {
            episode.checkLock().unlock();
        }
    }

    private PositionSample fetchPosition(VerificationEpisode episode, int checkNumber) {
        try {
            return location.fetchCurrentPosition();
        } catch (PositionUnavailableException e) {
            metrics.incrementVerificationCheck("unavailable");
            LOG.info("Verification check {} for session {}: position unavailable ({})",
                    checkNumber, episode.sessionId(), e.getMessage());
            return null;
        }
    }

    private VerificationVerdict grade(VerificationEpisode episode, PositionSample sample, int checkNumber) {
        Site site = episode.site();
        if (site == null) {
            metrics.incrementVerificationCheck("uncertain");
            return null;
        }
        SampleAssessment assessment = evaluator.assess(sample, site);
        LOG.info("Verification check {} for session {}: distance={}m accuracy={} tier={}",
                checkNumber, episode.sessionId(), Math.round(assessment.distanceMeters()),
                LogSanitizer.accuracy(sample.accuracy()), assessment.tier());
        if (assessment.confidentlyOutside()) {
            metrics.incrementVerificationCheck("outside");
            return VerificationVerdict.CONFIRMED_OUTSIDE;
        }
        if (assessment.confidentlyInside()) {
            metrics.incrementVerificationCheck("inside");
            return VerificationVerdict.CONFIRMED_INSIDE;
        }
        metrics.incrementVerificationCheck("uncertain");
        return null;
    }

    private void deliver(VerificationEpisode episode, VerificationVerdict verdict, PositionSample sample,
                         Instant dueAt, int checkNumber) {
        ExitVerificationCompletedEvent event = new ExitVerificationCompletedEvent(
                episode.sessionId(), episode.siteId(), episode.pendingExitAt(), verdict, sample, dueAt, checkNumber);
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Delivering verdict {} for session {} failed; episode stays open: {}",
                    verdict, episode.sessionId(), e.toString());
            return;
        }
        if (episode.close()) {
            episodes.remove(episode.sessionId(), episode);
        }
    }
}
