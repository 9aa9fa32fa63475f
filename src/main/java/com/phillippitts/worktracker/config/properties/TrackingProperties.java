package com.phillippitts.worktracker.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the tracking engine ({@code tracking.*}).
 *
 * <p>The distance margin and verification offsets are still being tuned in the field, so they
 * are treated as parameters rather than fixed contracts.
 */
@Validated
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    /** Minimum spacing between accepted transitions for the same site. */
    @PositiveOrZero(message = "Cooldown seconds must not be negative")
    private int cooldownSeconds = 10;

    /** Accuracy (meters) strictly below which a reading counts as high confidence. */
    @Positive(message = "High-confidence accuracy must be positive")
    private double highConfidenceAccuracyMeters = 50;

    /** Delays after a pending exit at which verification checks run. */
    @NotEmpty(message = "At least one verification offset is required")
    private List<@Positive Integer> verificationOffsetsMinutes = new ArrayList<>(List.of(1, 3, 5));

    /** Completed sessions shorter than this are flagged short and left out of hour totals. */
    @PositiveOrZero(message = "Minimum session minutes must not be negative")
    private int minimumSessionMinutes = 5;

    /** Extra distance beyond the radius a sample must clear to count as outside. */
    @PositiveOrZero(message = "Exit margin must not be negative")
    private double exitMarginMeters = 0;

    /** Exits reported with an accuracy worse than this are ignored. */
    @Positive(message = "Poor accuracy threshold must be positive")
    private double poorAccuracyMeters = 100;

    /** Exits whose accuracy is this many times worse than the check-in accuracy are ignored. */
    @Min(value = 1, message = "Degradation factor must be at least 1")
    private double degradationFactor = 3;

    /** Interval of the stale pending-exit sweep. */
    @Positive(message = "Reconcile interval must be positive")
    private long reconcileIntervalMs = 60_000;

    @Valid
    private SiteProperties site = new SiteProperties();

    @Valid
    private PositionProperties position = new PositionProperties();

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(int cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public double getHighConfidenceAccuracyMeters() {
        return highConfidenceAccuracyMeters;
    }

    public void setHighConfidenceAccuracyMeters(double highConfidenceAccuracyMeters) {
        this.highConfidenceAccuracyMeters = highConfidenceAccuracyMeters;
    }

    public List<Integer> getVerificationOffsetsMinutes() {
        return verificationOffsetsMinutes;
    }

    public void setVerificationOffsetsMinutes(List<Integer> verificationOffsetsMinutes) {
        this.verificationOffsetsMinutes = verificationOffsetsMinutes;
    }

    public int getMinimumSessionMinutes() {
        return minimumSessionMinutes;
    }

    public void setMinimumSessionMinutes(int minimumSessionMinutes) {
        this.minimumSessionMinutes = minimumSessionMinutes;
    }

    public double getExitMarginMeters() {
        return exitMarginMeters;
    }

    public void setExitMarginMeters(double exitMarginMeters) {
        this.exitMarginMeters = exitMarginMeters;
    }

    public double getPoorAccuracyMeters() {
        return poorAccuracyMeters;
    }

    public void setPoorAccuracyMeters(double poorAccuracyMeters) {
        this.poorAccuracyMeters = poorAccuracyMeters;
    }

    public double getDegradationFactor() {
        return degradationFactor;
    }

    public void setDegradationFactor(double degradationFactor) {
        this.degradationFactor = degradationFactor;
    }

    public long getReconcileIntervalMs() {
        return reconcileIntervalMs;
    }

    public void setReconcileIntervalMs(long reconcileIntervalMs) {
        this.reconcileIntervalMs = reconcileIntervalMs;
    }

    public SiteProperties getSite() {
        return site;
    }

    public void setSite(SiteProperties site) {
        this.site = site;
    }

    public PositionProperties getPosition() {
        return position;
    }

    public void setPosition(PositionProperties position) {
        this.position = position;
    }

    public Duration getCooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    /**
     * Verification offsets as durations, ascending and without duplicates.
     *
     * @return offsets after the pending exit at which checks run
     */
    public List<Duration> getVerificationOffsets() {
        return verificationOffsetsMinutes.stream()
                .filter(m -> m != null && m > 0)
                .distinct()
                .sorted()
                .map(Duration::ofMinutes)
                .toList();
    }

    /**
     * The last verification offset; a pending exit older than this has exhausted its schedule.
     *
     * @return maximum verification window
     */
    public Duration getMaxVerificationWindow() {
        List<Duration> offsets = getVerificationOffsets();
        return offsets.isEmpty() ? Duration.ZERO : offsets.get(offsets.size() - 1);
    }

    /**
     * Site radius bounds.
     */
    public static class SiteProperties {
        @Positive
        private double minRadiusMeters = 100;
        @Positive
        private double maxRadiusMeters = 1000;
        @Positive
        private double defaultRadiusMeters = 200;

        public double getMinRadiusMeters() {
            return minRadiusMeters;
        }

        public void setMinRadiusMeters(double minRadiusMeters) {
            this.minRadiusMeters = minRadiusMeters;
        }

        public double getMaxRadiusMeters() {
            return maxRadiusMeters;
        }

        public void setMaxRadiusMeters(double maxRadiusMeters) {
            this.maxRadiusMeters = maxRadiusMeters;
        }

        public double getDefaultRadiusMeters() {
            return defaultRadiusMeters;
        }

        public void setDefaultRadiusMeters(double defaultRadiusMeters) {
            this.defaultRadiusMeters = defaultRadiusMeters;
        }
    }

    /**
     * Freshness of device-reported positions used for active fetches.
     */
    public static class PositionProperties {
        @Positive
        private int maxAgeSeconds = 120;

        public int getMaxAgeSeconds() {
            return maxAgeSeconds;
        }

        public void setMaxAgeSeconds(int maxAgeSeconds) {
            this.maxAgeSeconds = maxAgeSeconds;
        }
    }
}
