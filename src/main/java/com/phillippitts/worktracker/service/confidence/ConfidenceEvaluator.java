package com.phillippitts.worktracker.service.confidence;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.domain.Site;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Pure classifier from an accuracy (and optionally a distance) reading to a confidence tier.
 *
 * <p>Used to gate immediate commits on exit and to grade each verification sample.
 * Holds only configuration; safe to share across threads.
 */
@Component
public class ConfidenceEvaluator {

    private final double highConfidenceAccuracyMeters;
    private final double exitMarginMeters;

    public ConfidenceEvaluator(TrackingProperties props) {
        Objects.requireNonNull(props, "props");
        this.highConfidenceAccuracyMeters = props.getHighConfidenceAccuracyMeters();
        this.exitMarginMeters = props.getExitMarginMeters();
    }

    /**
     * Classifies an accuracy reading.
     *
     * @param accuracy accuracy radius in meters, may be {@code null}
     * @return HIGH below the threshold, LOW at or above it, UNKNOWN when unusable
     */
    public ConfidenceTier tierOf(Double accuracy) {
        if (accuracy == null || accuracy.isNaN() || accuracy < 0) {
            return ConfidenceTier.UNKNOWN;
        }
        return accuracy < highConfidenceAccuracyMeters ? ConfidenceTier.HIGH : ConfidenceTier.LOW;
    }

    /**
     * Grades a sample against a site's circle.
     *
     * @param sample position reading
     * @param site   site whose centre and radius apply
     * @return tier, distance and in/out flags
     */
    public SampleAssessment assess(PositionSample sample, Site site) {
        ConfidenceTier tier = tierOf(sample.accuracy());
        double distance = GeoDistance.meters(
                sample.latitude(), sample.longitude(), site.latitude(), site.longitude());
        boolean outside = distance > site.radiusMeters() + exitMarginMeters;
        boolean inside = tier.isHigh() && distance + sample.accuracy() < site.radiusMeters();
        return new SampleAssessment(tier, distance, outside, inside);
    }
}
