package com.adaptivesentinel.core.threshold;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes and commits adaptive thresholds for metrics.
 *
 * <p>
 * The manager holds only configuration. All per-metric data lives in the
 * {@link ThresholdState} passed to each call, which lets the in-process
 * pipeline and the Flink job share one implementation.
 * </p>
 *
 * <h3>Hysteresis</h3>
 * <p>
 * A recomputed candidate replaces the committed threshold only if it differs
 * from it by more than {@code gateThreshold} (relative). The first candidate
 * of a metric is always committed.
 * </p>
 *
 * <h3>Failure Semantics</h3>
 * <p>
 * Empty windows make {@link #calculateAdaptiveThreshold(ThresholdState)}
 * throw {@link InsufficientDataException}; {@link #updateThreshold(ThresholdState)}
 * absorbs it and leaves the previous threshold in force.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdManager implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdManager.class);

    private final EngineConfig config;
    private final CheckPolicy checkPolicy;
    private final Clock clock;

    /**
     * Manager with the configured check policy and the system UTC clock.
     *
     * @param config engine configuration; must not be {@code null}
     */
    public ThresholdManager(EngineConfig config) {
        this(config,
                CheckPolicy.everyPointsOrInterval(config.getCheckEveryPoints(), config.checkInterval()),
                Clock.systemUTC());
    }

    /**
     * @param config      engine configuration; must not be {@code null}
     * @param checkPolicy when to recompute; must not be {@code null}
     * @param clock       source of adjustment timestamps; must not be {@code null}
     */
    public ThresholdManager(EngineConfig config, CheckPolicy checkPolicy, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.checkPolicy = Objects.requireNonNull(checkPolicy, "checkPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Create empty state for a metric seen for the first time.
     *
     * @param metricName the metric; must not be {@code null}
     * @return fresh state sized by the configured windows
     */
    public ThresholdState newState(String metricName) {
        return new ThresholdState(metricName, config.shortWindow(), config.longWindow());
    }

    /**
     * Route a reading into both windows of the metric.
     */
    public void addMetric(ThresholdState state, double value, Instant timestamp) {
        state.getShortWindow().addPoint(value, timestamp);
        state.getLongWindow().addPoint(value, timestamp);
    }

    /**
     * Compute the candidate threshold from the metric's windows, scaled by
     * its sensitivity multiplier.
     *
     * @param state the metric's state
     * @return the candidate
     * @throws InsufficientDataException if either window is empty
     */
    public double calculateAdaptiveThreshold(ThresholdState state) {
        if (state.getShortWindow().isEmpty() || state.getLongWindow().isEmpty()) {
            throw new InsufficientDataException("Metric '" + state.getMetricName()
                    + "' has no data in its " + (state.getShortWindow().isEmpty() ? "short" : "long") + " window");
        }
        WindowStatistics shortStats = state.getShortWindow().statistics();
        WindowStatistics longStats = state.getLongWindow().statistics();
        return ThresholdCalculator.candidate(shortStats, longStats,
                config.getVolatilityMultiplier(), state.getSensitivityMultiplier());
    }

    /**
     * Hysteresis gate.
     *
     * @param state     the metric's state
     * @param candidate a freshly computed candidate
     * @return {@code true} if the candidate should replace the committed value
     */
    public boolean shouldCommit(ThresholdState state, double candidate) {
        if (!state.hasThreshold()) {
            return true;
        }
        double current = state.getCurrentThreshold();
        if (current == 0) {
            return candidate != 0;
        }
        return Math.abs(candidate - current) / current > config.getGateThreshold();
    }

    /**
     * Recompute the threshold and commit it if it passes the gate.
     *
     * @param state the metric's state
     * @return the committed adjustment, or empty if nothing changed
     */
    public Optional<ThresholdAdjustment> updateThreshold(ThresholdState state) {
        double candidate;
        try {
            candidate = calculateAdaptiveThreshold(state);
        } catch (InsufficientDataException e) {
            LOG.debug("Skipping threshold update: {}", e.getMessage());
            return Optional.empty();
        }

        if (!Double.isFinite(candidate)) {
            LOG.warn("Metric [{}]: discarding non-finite candidate {}", state.getMetricName(), candidate);
            return Optional.empty();
        }

        if (!shouldCommit(state, candidate)) {
            LOG.trace("Metric [{}]: candidate {} within gate of {}",
                    state.getMetricName(), candidate, state.getCurrentThreshold());
            return Optional.empty();
        }

        double previous = state.getCurrentThreshold();
        ThresholdAdjustment adjustment = new ThresholdAdjustment(
                state.getMetricName(),
                clock.instant(),
                previous,
                candidate,
                String.format(Locale.ROOT, "updated from %.2f to %.2f", previous, candidate),
                ThresholdAdjustment.Source.RECOMPUTED);
        state.apply(adjustment);
        LOG.debug("Metric [{}] threshold {} -> {}", state.getMetricName(), previous, candidate);
        return Optional.of(adjustment);
    }

    /**
     * Count one folded point and recompute if the check policy says so.
     *
     * <p>
     * The interval of the policy is measured from the first point a metric
     * ever folded, until the first recomputation.
     * </p>
     *
     * @param state the metric's state
     * @return the committed adjustment, or empty if nothing changed
     */
    public Optional<ThresholdAdjustment> maybeUpdate(ThresholdState state) {
        Instant now = clock.instant();
        state.countPoint();
        if (state.lastCheck() == null) {
            state.startCheckClock(now);
        }

        Duration elapsed = Duration.between(state.lastCheck(), now);
        if (!checkPolicy.shouldCheck(state.pointsSinceCheck(), elapsed)) {
            return Optional.empty();
        }
        state.markChecked(now);
        return updateThreshold(state);
    }

    /**
     * @return {@code true} if {@code value} exceeds the committed threshold
     */
    public boolean isAnomalous(ThresholdState state, double value) {
        return state.hasThreshold() && value > state.getCurrentThreshold();
    }
}
