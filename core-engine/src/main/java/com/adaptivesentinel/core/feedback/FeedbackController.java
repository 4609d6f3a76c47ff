package com.adaptivesentinel.core.feedback;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Tunes a metric's sensitivity from alert-outcome feedback.
 *
 * <h3>Algorithm</h3>
 * <p>
 * Feedback entries accumulate in the metric's {@link ThresholdState}. Once
 * {@code feedbackBatchSize} entries are pending they are consumed together
 * and the false-positive rate (share of alerts marked not useful) decides:
 * </p>
 * <ul>
 * <li>rate &gt; {@code falsePositiveHigh}: threshold and multiplier ×
 * {@code desensitizeFactor} (fewer alerts)</li>
 * <li>rate &lt; {@code falsePositiveLow}: threshold and multiplier ×
 * {@code sensitizeFactor} (more alerts)</li>
 * <li>otherwise nothing changes</li>
 * </ul>
 *
 * <p>
 * The committed threshold is changed directly, without the hysteresis gate
 * of {@link com.adaptivesentinel.core.threshold.ThresholdManager}: feedback
 * is a verdict on actual alerts, not a noisy estimate. Each change is
 * appended to the adjustment history with source
 * {@link ThresholdAdjustment.Source#FEEDBACK}. Before the first commit only
 * the multiplier moves and no history entry is written.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Stateless apart from configuration; must run on the thread that owns the
 * metric's state.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackController implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FeedbackController.class);

    /** Prefix of the history reason of every feedback-driven change. */
    public static final String REASON_PREFIX = "feedback-driven sensitivity change";

    private final EngineConfig config;
    private final Clock clock;

    public FeedbackController(EngineConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * @param config engine configuration; must not be {@code null}
     * @param clock  source of adjustment timestamps; must not be {@code null}
     */
    public FeedbackController(EngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Record one alert outcome and adjust sensitivity when a full batch of
     * outcomes is available.
     *
     * @param state     the metric's state
     * @param wasUseful whether the alert pointed at a real problem
     * @return the resulting adjustment, or empty if nothing changed
     */
    public Optional<ThresholdAdjustment> recordFeedback(ThresholdState state, boolean wasUseful) {
        Objects.requireNonNull(state, "state must not be null");
        state.appendFeedback(wasUseful);

        int batchSize = config.getFeedbackBatchSize();
        if (state.pendingFeedback() < batchSize) {
            return Optional.empty();
        }

        List<Boolean> batch = state.consumeFeedback(batchSize);
        long useful = batch.stream().filter(Boolean::booleanValue).count();
        double falsePositiveRate = 1.0 - (double) useful / batch.size();

        double factor;
        if (falsePositiveRate > config.getFalsePositiveHigh()) {
            factor = config.getDesensitizeFactor();
        } else if (falsePositiveRate < config.getFalsePositiveLow()) {
            factor = config.getSensitizeFactor();
        } else {
            LOG.debug("Metric [{}]: false-positive rate {} within bounds, sensitivity unchanged",
                    state.getMetricName(), falsePositiveRate);
            return Optional.empty();
        }

        state.scaleSensitivity(factor);
        if (!state.hasThreshold()) {
            LOG.info("Metric [{}] sensitivity x{} after false-positive rate {} (no threshold committed yet)",
                    state.getMetricName(), factor, falsePositiveRate);
            return Optional.empty();
        }

        double previous = state.getCurrentThreshold();
        double updated = previous * factor;

        ThresholdAdjustment adjustment = new ThresholdAdjustment(
                state.getMetricName(),
                clock.instant(),
                previous,
                updated,
                String.format(Locale.ROOT, "%s: false-positive rate %.2f, threshold %.2f -> %.2f",
                        REASON_PREFIX, falsePositiveRate, previous, updated),
                ThresholdAdjustment.Source.FEEDBACK);
        state.apply(adjustment);

        LOG.info("Metric [{}] sensitivity x{} after false-positive rate {} (threshold {} -> {})",
                state.getMetricName(), factor, falsePositiveRate, previous, updated);
        return Optional.of(adjustment);
    }
}
