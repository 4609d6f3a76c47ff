package com.adaptivesentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getMetricsTopic()).isEqualTo("metrics");
        assertThat(config.getFeedbackTopic()).isEqualTo("alert-feedback");
        assertThat(config.getAlertsTopic()).isEqualTo("threshold-alerts");
        assertThat(config.getAdjustmentsTopic()).isEqualTo("threshold-adjustments");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getEngineConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank topic")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().alertsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alertsTopic");
    }

    @Test
    @DisplayName("Should reject reading metrics and feedback from the same topic")
    void shouldRejectSharedInputTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().metricsTopic("in").feedbackTopic("in").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    @DisplayName("Should reject non-positive parallelism and checkpoint interval")
    void shouldRejectInvalidNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkpointIntervalMs");
    }
}
