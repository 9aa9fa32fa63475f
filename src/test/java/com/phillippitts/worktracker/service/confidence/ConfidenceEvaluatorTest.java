package com.phillippitts.worktracker.service.confidence;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-03-03T12:00:00Z");
    private static final Site SITE = new Site("hq", "Head office", 40.0, -74.0, 200, true, NOW, NOW);

    private final ConfidenceEvaluator evaluator = new ConfidenceEvaluator(new TrackingProperties());

    @Test
    void accuracyBelowThresholdIsHigh() {
        assertThat(evaluator.tierOf(10.0)).isEqualTo(ConfidenceTier.HIGH);
        assertThat(evaluator.tierOf(49.9)).isEqualTo(ConfidenceTier.HIGH);
    }

    @Test
    void accuracyAtOrAboveThresholdIsLow() {
        assertThat(evaluator.tierOf(50.0)).isEqualTo(ConfidenceTier.LOW);
        assertThat(evaluator.tierOf(300.0)).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    void missingOrInvalidAccuracyIsUnknown() {
        assertThat(evaluator.tierOf(null)).isEqualTo(ConfidenceTier.UNKNOWN);
        assertThat(evaluator.tierOf(Double.NaN)).isEqualTo(ConfidenceTier.UNKNOWN);
        assertThat(evaluator.tierOf(-1.0)).isEqualTo(ConfidenceTier.UNKNOWN);
        assertThat(ConfidenceTier.UNKNOWN.isHigh()).isFalse();
    }

    @Test
    void preciseFarSampleIsConfidentlyOutside() {
        SampleAssessment a = evaluator.assess(new PositionSample(40.01, -74.0, 20.0, NOW), SITE);

        assertThat(a.distanceMeters()).isBetween(1100.0, 1125.0);
        assertThat(a.confidentlyOutside()).isTrue();
        assertThat(a.confidentlyInside()).isFalse();
    }

    @Test
    void impreciseFarSampleIsOutsideButNotConfident() {
        SampleAssessment a = evaluator.assess(new PositionSample(40.01, -74.0, 80.0, NOW), SITE);

        assertThat(a.outsideRange()).isTrue();
        assertThat(a.confidentlyOutside()).isFalse();
    }

    @Test
    void insideRequiresWholeAccuracyCircleWithinRadius() {
        // about 111 m north of the centre
        PositionSample nearEdge = new PositionSample(40.001, -74.0, 40.0, NOW);
        PositionSample overlapping = new PositionSample(40.001, -74.0, 95.0, NOW);

        assertThat(evaluator.assess(nearEdge, SITE).confidentlyInside()).isTrue();
        assertThat(evaluator.assess(overlapping, SITE).confidentlyInside()).isFalse();
        assertThat(evaluator.assess(overlapping, SITE).outsideRange()).isFalse();
    }

    @Test
    void exitMarginWidensOutsideBoundary() {
        TrackingProperties props = new TrackingProperties();
        props.setExitMarginMeters(100);
        ConfidenceEvaluator withMargin = new ConfidenceEvaluator(props);
        // about 278 m from the centre: outside 200 m but inside 200 + 100
        PositionSample sample = new PositionSample(40.0025, -74.0, 10.0, NOW);

        assertThat(evaluator.assess(sample, SITE).confidentlyOutside()).isTrue();
        assertThat(withMargin.assess(sample, SITE).confidentlyOutside()).isFalse();
    }
}
