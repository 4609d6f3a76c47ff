package com.adaptivesentinel.core.threshold;

import com.adaptivesentinel.core.model.WindowStatistics;

import java.util.Objects;

/**
 * Dual-window candidate threshold rule.
 *
 * <h3>Regimes</h3>
 * <ul>
 * <li><b>Conservative</b>: when recent volatility exceeds historical
 * volatility by more than {@code volatilityMultiplier}, the candidate is the
 * long window's p99.</li>
 * <li><b>Normal</b>: otherwise the candidate is the long window's p95 plus
 * twice the short window's standard deviation.</li>
 * </ul>
 *
 * <h3>Zero means</h3>
 * <p>
 * Volatility is the coefficient of variation ({@code std / mean}). A zero
 * short-window mean leaves recent volatility undefined, which always selects
 * the conservative regime. A zero long-window mean counts as zero historical
 * volatility. Neither case divides by zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdCalculator {

    private ThresholdCalculator() {
        // utility class, not instantiable
    }

    /**
     * Compute the candidate threshold for one metric.
     *
     * @param shortStats           statistics of the recent window
     * @param longStats            statistics of the historical window
     * @param volatilityMultiplier turbulence ratio that selects the conservative regime
     * @param sensitivity          multiplier applied to the regime's result
     * @return the candidate, never negative
     */
    public static double candidate(WindowStatistics shortStats, WindowStatistics longStats,
            double volatilityMultiplier, double sensitivity) {
        Objects.requireNonNull(shortStats, "shortStats must not be null");
        Objects.requireNonNull(longStats, "longStats must not be null");

        double raw = isTurbulent(shortStats, longStats, volatilityMultiplier)
                ? longStats.getP99()
                : longStats.getP95() + 2 * shortStats.getStd();
        return Math.max(0.0, raw * sensitivity);
    }

    /**
     * @return {@code true} if the recent window is turbulent relative to the
     *         historical baseline
     */
    static boolean isTurbulent(WindowStatistics shortStats, WindowStatistics longStats,
            double volatilityMultiplier) {
        if (shortStats.getMean() == 0) {
            return true;
        }
        double recentVolatility = shortStats.getStd() / shortStats.getMean();
        return recentVolatility > historicalVolatility(longStats) * volatilityMultiplier;
    }

    static double historicalVolatility(WindowStatistics longStats) {
        return longStats.getMean() == 0 ? 0.0 : longStats.getStd() / longStats.getMean();
    }
}
