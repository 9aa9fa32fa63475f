package com.phillippitts.worktracker.service.location;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;
import com.phillippitts.worktracker.exception.PositionUnavailableException;
import com.phillippitts.worktracker.service.tracking.TransitionOutcome;
import com.phillippitts.worktracker.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Location capability fed by the device over HTTP.
 *
 * <p>The device performs the actual region monitoring and pushes crossings and periodic
 * position reports. Monitors registered here are the set of circles the device is expected
 * to watch; transitions for unmonitored sites are still delivered so that an exit arriving
 * just after a site was deactivated can close its session.
 *
 * <p>{@link #fetchCurrentPosition()} answers from the most recent report, provided it is
 * younger than {@code tracking.position.max-age-seconds}.
 */
@Component
public class ReportedPositionCapability implements LocationCapability {

    private static final Logger LOG = LogManager.getLogger(ReportedPositionCapability.class);

    private final Clock clock;
    private final Duration maxAge;
    private final Set<String> monitored = ConcurrentHashMap.newKeySet();
    private final AtomicReference<PositionSample> latest = new AtomicReference<>();
    private volatile TransitionListener listener;

    public ReportedPositionCapability(Clock clock, TrackingProperties props) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAge = Duration.ofSeconds(props.getPosition().getMaxAgeSeconds());
    }

    @Override
    public void registerMonitor(Site site) {
        if (monitored.add(site.id())) {
            LOG.info("Monitoring site {} ({}), radius={}m", site.id(), site.name(),
                    Math.round(site.radiusMeters()));
        }
    }

    @Override
    public void unregisterMonitor(String siteId) {
        if (monitored.remove(siteId)) {
            LOG.info("Stopped monitoring site {}", siteId);
        }
    }

    @Override
    public Set<String> monitoredSiteIds() {
        return Collections.unmodifiableSet(monitored);
    }

    @Override
    public void setTransitionListener(TransitionListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Delivers a crossing reported by the device.
     *
     * @param transition validated transition
     * @return engine outcome
     * @throws IllegalStateException if no listener has been wired yet
     */
    public TransitionOutcome deliverTransition(LocationTransition transition) {
        TransitionListener current = listener;
        if (current == null) {
            throw new IllegalStateException("Tracking engine not ready: no transition listener registered");
        }
        if (!monitored.contains(transition.siteId())) {
            LOG.debug("Transition for unmonitored site {}", transition.siteId());
        }
        return current.onTransition(transition);
    }

    /**
     * Records a periodic position report; older reports never replace newer ones.
     */
    public void reportPosition(PositionSample sample) {
        Objects.requireNonNull(sample, "sample");
        latest.accumulateAndGet(sample,
                (prev, next) -> prev == null || !next.timestamp().isBefore(prev.timestamp()) ? next : prev);
        LOG.debug("Position report at {} accuracy={}", LogSanitizer.coarse(sample.latitude(), sample.longitude()),
                LogSanitizer.accuracy(sample.accuracy()));
    }

    @Override
    public PositionSample fetchCurrentPosition() {
        PositionSample sample = latest.get();
        if (sample == null) {
            throw new PositionUnavailableException("No position has been reported yet");
        }
        Duration age = Duration.between(sample.timestamp(), clock.instant());
        if (age.compareTo(maxAge) > 0) {
            throw new PositionUnavailableException("Last reported position is stale (" + age.toSeconds() + "s old)");
        }
        return sample;
    }
}
