package com.adaptivesentinel.core.feedback;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeedbackController}.
 */
class FeedbackControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:30:00Z");
    private static final String METRIC = "payment_error_rate";

    private FeedbackController controller;
    private ThresholdState state;

    @BeforeEach
    void setUp() {
        controller = new FeedbackController(new EngineConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
        state = new ThresholdState(METRIC, Duration.ofMinutes(30), Duration.ofHours(24));
        state.apply(new ThresholdAdjustment(METRIC, NOW, 0, 100, "seeded",
                ThresholdAdjustment.Source.RECOMPUTED));
    }

    @Test
    @DisplayName("Should raise the threshold by exactly 1.1x when 9 of 10 alerts were false")
    void shouldRaiseThresholdOnNoisyAlerts() {
        Optional<ThresholdAdjustment> adjustment = record(1, 9);

        assertThat(adjustment).isPresent();
        assertThat(adjustment.get().getSource()).isEqualTo(ThresholdAdjustment.Source.FEEDBACK);
        assertThat(adjustment.get().getPreviousThreshold()).isEqualTo(100.0);
        assertThat(adjustment.get().getNewThreshold()).isEqualTo(100 * 1.1);
        assertThat(adjustment.get().getReason()).startsWith(FeedbackController.REASON_PREFIX);
        assertThat(adjustment.get().getTimestamp()).isEqualTo(NOW);
        assertThat(state.getCurrentThreshold()).isEqualTo(100 * 1.1);
        assertThat(state.getSensitivityMultiplier()).isCloseTo(1.1, within(1e-9));
        assertThat(state.getAdjustmentHistory()).hasSize(2).last().isEqualTo(adjustment.get());
    }

    @Test
    @DisplayName("Should lower the threshold by exactly 0.9x when every alert was useful")
    void shouldLowerThresholdOnAccurateAlerts() {
        Optional<ThresholdAdjustment> adjustment = record(10, 0);

        assertThat(adjustment).isPresent();
        assertThat(state.getCurrentThreshold()).isEqualTo(100 * 0.9);
        assertThat(state.getSensitivityMultiplier()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Should desensitize on a false-positive rate just above 20%")
    void shouldRaiseThresholdAboveUpperBound() {
        Optional<ThresholdAdjustment> adjustment = record(7, 3);

        assertThat(adjustment).isPresent();
        assertThat(state.getCurrentThreshold()).isCloseTo(110.0, within(1e-9));
    }

    @Test
    @DisplayName("Should only move the multiplier while no threshold is committed")
    void shouldNotRecordHistoryBeforeFirstCommit() {
        state = new ThresholdState(METRIC, Duration.ofMinutes(30), Duration.ofHours(24));

        Optional<ThresholdAdjustment> adjustment = record(0, 10);

        assertThat(adjustment).isEmpty();
        assertThat(state.hasThreshold()).isFalse();
        assertThat(state.getAdjustmentHistory()).isEmpty();
        assertThat(state.getSensitivityMultiplier()).isCloseTo(1.1, within(1e-9));
        assertThat(state.pendingFeedback()).isZero();
    }

    @Test
    @DisplayName("Should leave sensitivity alone for a false-positive rate between the bounds")
    void shouldKeepThresholdWithinBounds() {
        Optional<ThresholdAdjustment> adjustment = record(9, 1);

        assertThat(adjustment).isEmpty();
        assertThat(state.getCurrentThreshold()).isEqualTo(100.0);
        assertThat(state.getSensitivityMultiplier()).isEqualTo(1.0);
        assertThat(state.pendingFeedback()).isZero();
    }

    @Test
    @DisplayName("Should wait for a full batch of feedback before evaluating")
    void shouldWaitForFullBatch() {
        Optional<ThresholdAdjustment> adjustment = record(0, 9);

        assertThat(adjustment).isEmpty();
        assertThat(state.pendingFeedback()).isEqualTo(9);
        assertThat(state.getAdjustmentHistory()).hasSize(1);
    }

    @Test
    @DisplayName("Should evaluate each batch of ten independently")
    void shouldConsumeEvaluatedEntries() {
        record(10, 0);
        Optional<ThresholdAdjustment> second = record(10, 0);

        assertThat(second).isPresent();
        assertThat(state.getCurrentThreshold()).isCloseTo(81.0, within(1e-9));
        assertThat(state.getAdjustmentHistory()).hasSize(3);
        assertThat(state.pendingFeedback()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Record {@code useful} positive outcomes followed by {@code falsePositives}
     * negative ones.
     *
     * @return result of the last call
     */
    private Optional<ThresholdAdjustment> record(int useful, int falsePositives) {
        Optional<ThresholdAdjustment> last = Optional.empty();
        for (int i = 0; i < useful; i++) {
            last = controller.recordFeedback(state, true);
        }
        for (int i = 0; i < falsePositives; i++) {
            last = controller.recordFeedback(state, false);
        }
        return last;
    }
}
