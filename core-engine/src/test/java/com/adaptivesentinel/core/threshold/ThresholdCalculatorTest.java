package com.adaptivesentinel.core.threshold;

import com.adaptivesentinel.core.model.WindowStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ThresholdCalculator}.
 */
class ThresholdCalculatorTest {

    private static final WindowStatistics HISTORY = stats(100, 10, 120, 130);

    @Test
    @DisplayName("Should use long p95 plus two short std in a calm regime")
    void shouldUseNormalRegime() {
        // recent volatility 0.1 vs. historical 0.1 * 1.5
        double candidate = ThresholdCalculator.candidate(stats(100, 10, 0, 0), HISTORY, 1.5, 1.0);

        assertThat(candidate).isCloseTo(140.0, within(1e-9));
    }

    @Test
    @DisplayName("Should use long p99 when recent volatility exceeds 1.5x historical")
    void shouldUseConservativeRegime() {
        // recent volatility 0.2 is exactly twice the historical 0.1
        WindowStatistics turbulent = stats(100, 20, 0, 0);

        assertThat(ThresholdCalculator.isTurbulent(turbulent, HISTORY, 1.5)).isTrue();
        assertThat(ThresholdCalculator.candidate(turbulent, HISTORY, 1.5, 1.0)).isEqualTo(130.0);
    }

    @Test
    @DisplayName("Should scale the candidate by the sensitivity multiplier")
    void shouldApplySensitivity() {
        double candidate = ThresholdCalculator.candidate(stats(100, 10, 0, 0), HISTORY, 1.5, 1.1);

        assertThat(candidate).isCloseTo(154.0, within(1e-9));
    }

    @Test
    @DisplayName("Should take the conservative branch when the recent mean is zero")
    void shouldTreatZeroRecentMeanAsTurbulent() {
        WindowStatistics silent = stats(0, 0, 0, 0);

        assertThat(ThresholdCalculator.candidate(silent, HISTORY, 1.5, 1.0)).isEqualTo(130.0);
    }

    @Test
    @DisplayName("Should treat historical volatility as zero when the long mean is zero")
    void shouldTreatZeroHistoricalMeanAsCalmHistory() {
        WindowStatistics flatHistory = stats(0, 4, 3, 5);

        assertThat(ThresholdCalculator.historicalVolatility(flatHistory)).isZero();
        // any recent movement is turbulent against a zero baseline
        assertThat(ThresholdCalculator.candidate(stats(10, 1, 0, 0), flatHistory, 1.5, 1.0)).isEqualTo(5.0);
        // no recent movement stays in the normal regime
        assertThat(ThresholdCalculator.candidate(stats(10, 0, 0, 0), flatHistory, 1.5, 1.0)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should never produce a negative candidate")
    void shouldFloorAtZero() {
        WindowStatistics negativeHistory = stats(-50, 10, -30, -20);

        assertThat(ThresholdCalculator.candidate(stats(-40, 1, 0, 0), negativeHistory, 1.5, 1.0)).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WindowStatistics stats(double mean, double std, double p95, double p99) {
        return new WindowStatistics(10, mean, std, mean, p95, p99);
    }
}
