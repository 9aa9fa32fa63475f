package com.phillippitts.worktracker.service.verification;

import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One pending exit's set of scheduled checks.
 *
 * <p>{@link #close()} is idempotent and lock-free so it can be called from a thread that holds
 * a site lock while a check for the same episode is running.
 */
final class VerificationEpisode {

    private final String sessionId;
    private final String siteId;
    private final Site site;
    private final Instant pendingExitAt;
    private final List<ScheduledFuture<?>> timers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ReentrantLock checkLock = new ReentrantLock();
    private volatile PositionSample lastSample;

    VerificationEpisode(String sessionId, String siteId, Site site, Instant pendingExitAt) {
        this.sessionId = sessionId;
        this.siteId = siteId;
        this.site = site;
        this.pendingExitAt = pendingExitAt;
    }

    String sessionId() {
        return sessionId;
    }

    String siteId() {
        return siteId;
    }

    /** Site geometry at scheduling time; {@code null} if the site was unknown. */
    Site site() {
        return site;
    }

    Instant pendingExitAt() {
        return pendingExitAt;
    }

    PositionSample lastSample() {
        return lastSample;
    }

    void recordSample(PositionSample sample) {
        this.lastSample = sample;
    }

    void addTimer(ScheduledFuture<?> timer) {
        timers.add(timer);
        if (closed.get()) {
            timer.cancel(false);
        }
    }

    ReentrantLock checkLock() {
        return checkLock;
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * @return {@code true} while at least one check has neither run nor been cancelled
     */
    boolean hasPendingChecks() {
        if (closed.get()) {
            return false;
        }
        for (ScheduledFuture<?> timer : timers) {
            if (!timer.isDone()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Cancels outstanding checks.
     *
     * @return {@code true} only for the call that actually closed the episode
     */
    boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        for (ScheduledFuture<?> timer : timers) {
            timer.cancel(false);
        }
        return true;
    }
}
