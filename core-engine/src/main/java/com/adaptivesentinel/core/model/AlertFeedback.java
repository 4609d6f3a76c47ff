package com.adaptivesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Operator verdict on an alert previously raised for a metric.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlertFeedback implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final boolean useful;

    /**
     * @param metricName metric the alert was raised for; must not be {@code null}
     * @param useful     {@code true} if the alert pointed at a real problem
     */
    @JsonCreator
    public AlertFeedback(@JsonProperty("metricName") String metricName,
            @JsonProperty("wasUseful") boolean useful) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.useful = useful;
    }

    public String getMetricName() {
        return metricName;
    }

    @JsonProperty("wasUseful")
    public boolean wasUseful() {
        return useful;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertFeedback that))
            return false;
        return useful == that.useful && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, useful);
    }

    @Override
    public String toString() {
        return "AlertFeedback{metricName='" + metricName + "', wasUseful=" + useful + '}';
    }
}
