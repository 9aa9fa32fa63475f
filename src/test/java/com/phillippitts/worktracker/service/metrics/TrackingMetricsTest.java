package com.phillippitts.worktracker.service.metrics;

import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.TransitionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingMetricsTest {

    private SimpleMeterRegistry registry;
    private TrackingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TrackingMetrics(registry);
    }

    @Test
    void countsAcceptedTransitionsByType() {
        metrics.incrementAccepted(TransitionType.ENTER);
        metrics.incrementAccepted(TransitionType.ENTER);
        metrics.incrementAccepted(TransitionType.EXIT);

        assertThat(registry.get("worktracker.transition.accepted").tag("type", "enter").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("worktracker.transition.accepted").tag("type", "exit").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void countsIgnoredTransitionsByReason() {
        metrics.incrementIgnored(TransitionType.EXIT, IgnoreReason.POOR_ACCURACY);

        assertThat(registry.get("worktracker.transition.ignored")
                .tags("type", "exit", "reason", "poor_accuracy").counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsCompletedSessionsByResolution() {
        metrics.incrementCompleted(ExitResolution.VERIFIED, false);
        metrics.incrementCompleted(ExitResolution.VERIFIED, true);

        assertThat(registry.get("worktracker.session.completed").tag("resolution", "verified").counters())
                .hasSize(2);
        assertThat(registry.get("worktracker.session.completed").tag("short", "true").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void countsVerificationChecks() {
        metrics.incrementVerificationCheck("unavailable");

        assertThat(registry.get("worktracker.verification.check").tag("result", "unavailable").counter().count())
                .isEqualTo(1.0);
    }
}
