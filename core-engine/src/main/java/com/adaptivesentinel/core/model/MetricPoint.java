package com.adaptivesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A single raw reading of a named metric.
 *
 * <p>
 * Points are pushed by the ingress layer (or read from the metrics topic by
 * the Flink job) and are immutable once created.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Orders points by generation time; ties keep their relative order under a stable sort. */
    public static final Comparator<MetricPoint> BY_TIMESTAMP = Comparator.comparing(MetricPoint::getTimestamp);

    private final String metricName;
    private final double value;
    private final Instant timestamp;

    /**
     * @param metricName name of the metric series; must not be {@code null}
     * @param value      observed value
     * @param timestamp  generation time of the reading; must not be {@code null}
     * @throws NullPointerException     if {@code metricName} or {@code timestamp}
     *                                  is {@code null}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    @JsonCreator
    public MetricPoint(@JsonProperty("metricName") String metricName,
            @JsonProperty("value") double value,
            @JsonProperty("timestamp") Instant timestamp) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value of '" + metricName + "' must be finite, got: " + value);
        }
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, timestamp);
    }

    @Override
    public String toString() {
        return "MetricPoint{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
