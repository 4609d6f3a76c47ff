package com.adaptivesentinel.core.threshold;

import com.adaptivesentinel.core.model.ThresholdAdjustment;

import java.util.List;
import java.util.Objects;

/**
 * Immutable read view of a metric's committed threshold.
 *
 * <p>
 * Published by the owning worker after every change so that status and
 * alerting readers never touch the live {@link ThresholdState}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdSnapshot {

    private final String metricName;
    private final double currentThreshold;
    private final double sensitivityMultiplier;
    private final List<ThresholdAdjustment> adjustmentHistory;

    public ThresholdSnapshot(String metricName, double currentThreshold, double sensitivityMultiplier,
            List<ThresholdAdjustment> adjustmentHistory) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.currentThreshold = currentThreshold;
        this.sensitivityMultiplier = sensitivityMultiplier;
        this.adjustmentHistory = List.copyOf(adjustmentHistory);
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentThreshold() {
        return currentThreshold;
    }

    public double getSensitivityMultiplier() {
        return sensitivityMultiplier;
    }

    /**
     * @return adjustment history, oldest first (unmodifiable)
     */
    public List<ThresholdAdjustment> getAdjustmentHistory() {
        return adjustmentHistory;
    }

    /**
     * @return {@code true} once any threshold, including {@code 0}, was committed
     */
    public boolean hasThreshold() {
        return !adjustmentHistory.isEmpty();
    }

    /**
     * A value is anomalous when it exceeds the committed threshold. Nothing
     * is anomalous before the first threshold has been committed.
     *
     * @param value the reading to classify
     * @return {@code true} if the reading crosses the threshold
     */
    public boolean isAnomalous(double value) {
        return hasThreshold() && value > currentThreshold;
    }

    @Override
    public String toString() {
        return "ThresholdSnapshot{" +
                "metricName='" + metricName + '\'' +
                ", currentThreshold=" + currentThreshold +
                ", sensitivityMultiplier=" + sensitivityMultiplier +
                ", adjustments=" + adjustmentHistory.size() +
                '}';
    }
}
