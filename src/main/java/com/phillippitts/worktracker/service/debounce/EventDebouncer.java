package com.phillippitts.worktracker.service.debounce;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.service.store.TrackingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Suppresses repeated transitions for the same site inside a cooldown window.
 *
 * <p>Tracks the timestamp of the last accepted event per site. A transition is rejected when it
 * is less than {@code tracking.cooldown-seconds} after that event, regardless of type, which
 * absorbs boundary oscillation and duplicate platform reports. A transition timestamped before
 * the last accepted one is rejected too (stale delivery).
 *
 * <p>Rejected transitions are written to the audit log here with reason {@code debounced}.
 * Accepted transitions are forwarded; the caller records them and then calls
 * {@link #recordAccepted(LocationTransition)}, so a failed write never advances the window.
 *
 * <p><b>Recovery:</b> the per-site window lives in memory but is rebuilt lazily from
 * {@link TrackingStore#findLastAcceptedEvent(String)} the first time a site is seen after start.
 *
 * <p><b>Thread Safety:</b> callers serialize calls per site (the state machine holds a per-site lock).
 */
@Component
public class EventDebouncer {

    private static final Logger LOG = LogManager.getLogger(EventDebouncer.class);

    private final TrackingStore store;
    private final Duration cooldown;
    private final ConcurrentMap<String, Instant> lastAccepted = new ConcurrentHashMap<>();

    public EventDebouncer(TrackingStore store, TrackingProperties props) {
        this.store = Objects.requireNonNull(store, "store");
        this.cooldown = Objects.requireNonNull(props, "props").getCooldown();
    }

    /**
     * Decides whether a transition passes the cooldown window. Rejections are recorded.
     *
     * @param transition incoming transition
     * @return decision; only accepted transitions should reach the state machine
     */
    public DebounceDecision check(LocationTransition transition) {
        Optional<Instant> last = lastAcceptedFor(transition.siteId());
        if (last.isEmpty()) {
            return DebounceDecision.accept(null);
        }

        Duration elapsed = Duration.between(last.get(), transition.timestamp());
        if (elapsed.compareTo(cooldown) >= 0) {
            return DebounceDecision.accept(elapsed);
        }

        LOG.debug("Debouncing {} for site {}: {}ms since last accepted event (cooldown {}ms)",
                transition.type(), transition.siteId(), elapsed.toMillis(), cooldown.toMillis());
        store.appendEvent(TransitionEvent.ignored(transition, IgnoreReason.DEBOUNCED));
        return DebounceDecision.reject(elapsed);
    }

    /**
     * Advances the site's window after the accepted transition was durably recorded.
     *
     * @param transition the accepted transition
     */
    public void recordAccepted(LocationTransition transition) {
        lastAccepted.merge(transition.siteId(), transition.timestamp(),
                (prev, next) -> next.isAfter(prev) ? next : prev);
    }

    /**
     * Drops the cached window for a site, e.g. when the site is deleted.
     */
    public void forget(String siteId) {
        lastAccepted.remove(siteId);
    }

    private Optional<Instant> lastAcceptedFor(String siteId) {
        Instant cached = lastAccepted.get(siteId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Instant> recovered = store.findLastAcceptedEvent(siteId).map(TransitionEvent::timestamp);
        recovered.ifPresent(ts -> {
            lastAccepted.putIfAbsent(siteId, ts);
            LOG.debug("Recovered debounce window for site {} from store: last accepted at {}", siteId, ts);
        });
        return recovered;
    }
}
