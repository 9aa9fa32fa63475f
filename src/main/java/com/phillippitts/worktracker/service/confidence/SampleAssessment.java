package com.phillippitts.worktracker.service.confidence;

/**
 * Result of grading one position sample against a site.
 *
 * @param tier               confidence of the reading
 * @param distanceMeters     distance from the site centre
 * @param outsideRange       distance exceeds radius plus the exit margin
 * @param confidentlyInside  high confidence and the whole accuracy circle lies inside the radius
 */
public record SampleAssessment(
        ConfidenceTier tier,
        double distanceMeters,
        boolean outsideRange,
        boolean confidentlyInside
) {

    /**
     * High confidence and outside the radius plus margin: enough to commit an exit.
     */
    public boolean confidentlyOutside() {
        return tier.isHigh() && outsideRange;
    }
}
