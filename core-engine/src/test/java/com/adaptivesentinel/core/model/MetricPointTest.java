package com.adaptivesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricPointTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Test
    @DisplayName("Should reject a NaN reading")
    void shouldRejectNaN() {
        assertThatThrownBy(() -> new MetricPoint("cpu_usage", Double.NaN, T0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cpu_usage")
                .hasMessageContaining("finite");
    }

    @Test
    @DisplayName("Should reject infinite readings")
    void shouldRejectInfinity() {
        assertThatThrownBy(() -> new MetricPoint("cpu_usage", Double.POSITIVE_INFINITY, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricPoint("cpu_usage", Double.NEGATIVE_INFINITY, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should require a metric name and timestamp")
    void shouldRequireNameAndTimestamp() {
        assertThatThrownBy(() -> new MetricPoint(null, 1.0, T0))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new MetricPoint("cpu_usage", 1.0, null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should order points by timestamp and keep ties stable")
    void shouldOrderByTimestamp() {
        MetricPoint third = new MetricPoint("cpu_usage", 3, T0.plusSeconds(2));
        MetricPoint first = new MetricPoint("cpu_usage", 1, T0);
        MetricPoint tie = new MetricPoint("cpu_usage", 2, T0);

        List<MetricPoint> points = new ArrayList<>(List.of(third, first, tie));
        points.sort(MetricPoint.BY_TIMESTAMP);

        assertThat(points).containsExactly(first, tie, third);
    }
}
