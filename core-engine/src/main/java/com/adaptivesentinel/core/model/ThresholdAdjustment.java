package com.adaptivesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a metric's adjustment history.
 *
 * <p>
 * Emitted every time the committed threshold of a metric changes, either
 * because a recomputation passed the hysteresis gate or because alert
 * feedback moved it directly.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdAdjustment implements Serializable {

    private static final long serialVersionUID = 1L;

    /** What caused the change. */
    public enum Source {
        /** Statistical recomputation that passed the hysteresis gate. */
        RECOMPUTED,
        /** Sensitivity change driven by alert-outcome feedback. */
        FEEDBACK
    }

    private final String metricName;
    private final Instant timestamp;
    private final double previousThreshold;
    private final double newThreshold;
    private final String reason;
    private final Source source;

    public ThresholdAdjustment(String metricName, Instant timestamp, double previousThreshold,
            double newThreshold, String reason, Source source) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.previousThreshold = previousThreshold;
        this.newThreshold = newThreshold;
        this.reason = reason;
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public String getMetricName() {
        return metricName;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPreviousThreshold() {
        return previousThreshold;
    }

    public double getNewThreshold() {
        return newThreshold;
    }

    public String getReason() {
        return reason;
    }

    public Source getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdAdjustment that))
            return false;
        return Double.compare(previousThreshold, that.previousThreshold) == 0
                && Double.compare(newThreshold, that.newThreshold) == 0
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, timestamp, previousThreshold, newThreshold, source);
    }

    @Override
    public String toString() {
        return "ThresholdAdjustment{" +
                "metricName='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", previousThreshold=" + previousThreshold +
                ", newThreshold=" + newThreshold +
                ", reason='" + reason + '\'' +
                ", source=" + source +
                '}';
    }
}
