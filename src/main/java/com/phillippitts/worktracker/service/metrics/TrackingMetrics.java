package com.phillippitts.worktracker.service.metrics;

import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.TransitionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics for the tracking engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Accepted and ignored transitions, by type and ignore reason</li>
 *   <li>Completed sessions, by exit resolution</li>
 *   <li>Verification check results</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TrackingMetrics {

    private static final String METRIC_PREFIX = "worktracker";

    private final MeterRegistry registry;

    public TrackingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a transition that passed the debouncer and every guard.
     *
     * @param type enter or exit
     */
    public void incrementAccepted(TransitionType type) {
        Counter.builder(METRIC_PREFIX + ".transition.accepted")
                .description("Transitions that changed session state")
                .tag("type", tag(type))
                .register(registry)
                .increment();
    }

    /**
     * Counts a transition that was recorded but not acted upon.
     *
     * @param type   enter or exit
     * @param reason why it was ignored
     */
    public void incrementIgnored(TransitionType type, IgnoreReason reason) {
        Counter.builder(METRIC_PREFIX + ".transition.ignored")
                .description("Transitions recorded but ignored")
                .tag("type", tag(type))
                .tag("reason", reason.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Counts a session reaching COMPLETED.
     *
     * @param resolution how the exit was decided
     * @param shortSession whether it fell below the minimum-duration floor
     */
    public void incrementCompleted(ExitResolution resolution, boolean shortSession) {
        Counter.builder(METRIC_PREFIX + ".session.completed")
                .description("Sessions completed, by exit resolution")
                .tag("resolution", resolution.wireName())
                .tag("short", Boolean.toString(shortSession))
                .register(registry)
                .increment();
    }

    /**
     * Counts one verification check.
     *
     * @param result outside, inside, uncertain or unavailable
     */
    public void incrementVerificationCheck(String result) {
        Counter.builder(METRIC_PREFIX + ".verification.check")
                .description("Exit verification checks, by result")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    private static String tag(TransitionType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
