package com.adaptivesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted when a metric reading exceeds the committed threshold of its
 * metric.
 *
 * <p>
 * Serialized to JSON and published to the configured Kafka alerts topic by
 * the Flink job, or handed to an
 * {@link com.adaptivesentinel.core.pipeline.EngineListener} in-process.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} to construct instances. The builder enforces that
 * {@code metricName} and {@code timestamp} are present; omitting either will
 * throw a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdAlert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric whose reading crossed the threshold. */
    private String metricName;

    /** The offending reading. */
    private double value;

    /** Threshold in force when the reading was evaluated. */
    private double threshold;

    /** Generation time of the offending reading. */
    private Instant timestamp;

    /** Human-readable description of what was detected. */
    private String details;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public ThresholdAlert() {
    }

    private ThresholdAlert(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.value = builder.value;
        this.threshold = builder.threshold;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ThresholdAlert} instances.
     *
     * <p>
     * {@code metricName} and {@code timestamp} are <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String metricName;
        private double value;
        private double threshold;
        private Instant timestamp;
        private String details;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link ThresholdAlert}
         * @throws NullPointerException if {@code metricName} or {@code timestamp}
         *                              is {@code null}
         */
        public ThresholdAlert build() {
            return new ThresholdAlert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ThresholdAlert alert))
            return false;
        return Double.compare(value, alert.value) == 0
                && Objects.equals(metricName, alert.metricName)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, timestamp);
    }

    @Override
    public String toString() {
        return "ThresholdAlert{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", threshold=" + threshold +
                ", timestamp=" + timestamp +
                ", details='" + details + '\'' +
                '}';
    }
}
