package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import com.adaptivesentinel.core.threshold.CheckPolicy;
import com.adaptivesentinel.core.threshold.ThresholdManager;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricBatchProcessor}.
 */
class MetricBatchProcessorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");
    private static final String METRIC = "queue_depth";

    private MetricBatchProcessor processor;
    private ThresholdState state;

    @BeforeEach
    void setUp() {
        ThresholdManager manager = new ThresholdManager(new EngineConfig(), CheckPolicy.always(),
                Clock.fixed(T0, ZoneOffset.UTC));
        processor = new MetricBatchProcessor(manager);
        state = manager.newState(METRIC);
    }

    @Test
    @DisplayName("Should fold points in timestamp order regardless of arrival order")
    void shouldSortBatchByTimestamp() {
        MetricPoint late = point(3, 20);
        MetricPoint early = point(1, 10);
        MetricPoint middle = point(2, 15);

        BatchResult result = processor.process(state, List.of(late, early, middle));

        assertThat(result.getPoints()).containsExactly(early, middle, late);
        assertThat(state.getShortWindow().values()).containsExactly(10, 15, 20);
    }

    @Test
    @DisplayName("Should bootstrap a threshold from the first batch")
    void shouldBootstrapThreshold() {
        BatchResult result = processor.process(state, List.of(point(1, 10)));

        assertThat(result.getAdjustments()).hasSize(1);
        assertThat(result.getAdjustments().get(0).getSource()).isEqualTo(ThresholdAdjustment.Source.RECOMPUTED);
        assertThat(result.getAlerts()).isEmpty();
        assertThat(state.getCurrentThreshold()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should alert on a point above the threshold committed before it")
    void shouldAlertOnBreach() {
        processor.process(state, List.of(point(1, 10)));

        BatchResult result = processor.process(state, List.of(point(2, 10), point(3, 500)));

        assertThat(result.getAlerts()).hasSize(1);
        ThresholdAlert alert = result.getAlerts().get(0);
        assertThat(alert.getMetricName()).isEqualTo(METRIC);
        assertThat(alert.getValue()).isEqualTo(500.0);
        assertThat(alert.getThreshold()).isEqualTo(10.0);
        assertThat(alert.getTimestamp()).isEqualTo(T0.plusSeconds(3));
        assertThat(alert.getDetails()).isEqualTo("Threshold exceeded: queue_depth=500.00 (threshold: 10.00)");
    }

    @Test
    @DisplayName("Should alert on any positive reading after an all-zero baseline")
    void shouldAlertAboveZeroBaseline() {
        List<MetricPoint> zeros = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            zeros.add(point(i, 0.0));
        }
        processor.process(state, zeros);

        BatchResult result = processor.process(state, List.of(point(30, 0.5)));

        assertThat(result.getAlerts()).hasSize(1);
        assertThat(result.getAlerts().get(0).getThreshold()).isZero();
        assertThat(state.getAdjustmentHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a point belonging to another metric")
    void shouldRejectForeignMetric() {
        MetricPoint foreign = new MetricPoint("cpu_load", 1, T0);

        assertThatThrownBy(() -> processor.process(state, List.of(foreign)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cpu_load");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private MetricPoint point(int second, double value) {
        return new MetricPoint(METRIC, value, T0.plusSeconds(second));
    }
}
