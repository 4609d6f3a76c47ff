package com.adaptivesentinel.core.threshold;

import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.window.MetricWindow;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Everything the engine remembers about one metric.
 *
 * <h3>Contents</h3>
 * <ul>
 * <li>short and long {@link MetricWindow}s</li>
 * <li>committed threshold ({@code 0} until the first commit)</li>
 * <li>append-only adjustment history</li>
 * <li>sensitivity multiplier applied to every candidate</li>
 * <li>feedback entries not yet evaluated</li>
 * <li>recomputation bookkeeping for the {@link CheckPolicy}</li>
 * </ul>
 *
 * <h3>Ownership</h3>
 * <p>
 * Not thread-safe. Exactly one writer exists per metric: the pipeline worker
 * that owns it, or the Flink keyed operator for its key. Readers use
 * {@link #snapshot()}.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final MetricWindow shortWindow;
    private final MetricWindow longWindow;

    private double currentThreshold;
    private double sensitivityMultiplier = 1.0;
    private final List<ThresholdAdjustment> adjustmentHistory = new ArrayList<>();

    /** Feedback entries awaiting evaluation, oldest first. */
    private final Deque<Boolean> feedbackLog = new ArrayDeque<>();

    private long pointsSinceCheck;
    private Instant lastCheck;

    /**
     * @param metricName  metric this state belongs to; must not be {@code null}
     * @param shortWindow span of the recent window
     * @param longWindow  span of the historical window
     */
    public ThresholdState(String metricName, Duration shortWindow, Duration longWindow) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.shortWindow = new MetricWindow(shortWindow);
        this.longWindow = new MetricWindow(longWindow);
    }

    // ---------------------------------------------------------------
    // Threshold
    // ---------------------------------------------------------------

    public double getCurrentThreshold() {
        return currentThreshold;
    }

    /**
     * @return {@code true} once a threshold has been committed; a committed
     *         value of {@code 0} counts
     */
    public boolean hasThreshold() {
        return !adjustmentHistory.isEmpty();
    }

    /**
     * Commit an adjustment: set the threshold and append the history entry.
     *
     * @param adjustment the change to record; must belong to this metric
     * @throws IllegalArgumentException if the adjustment is for another metric
     *                                  or its threshold is negative or not finite
     */
    public void apply(ThresholdAdjustment adjustment) {
        Objects.requireNonNull(adjustment, "adjustment must not be null");
        if (!metricName.equals(adjustment.getMetricName())) {
            throw new IllegalArgumentException("Adjustment for '" + adjustment.getMetricName()
                    + "' applied to state of '" + metricName + "'");
        }
        if (!Double.isFinite(adjustment.getNewThreshold()) || adjustment.getNewThreshold() < 0) {
            throw new IllegalArgumentException("Threshold must be finite and >= 0, got: "
                    + adjustment.getNewThreshold());
        }
        currentThreshold = adjustment.getNewThreshold();
        adjustmentHistory.add(adjustment);
    }

    /**
     * @return adjustment history, oldest first (unmodifiable view)
     */
    public List<ThresholdAdjustment> getAdjustmentHistory() {
        return Collections.unmodifiableList(adjustmentHistory);
    }

    public double getSensitivityMultiplier() {
        return sensitivityMultiplier;
    }

    /**
     * @param factor positive factor to multiply the sensitivity multiplier by
     */
    public void scaleSensitivity(double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("Sensitivity factor must be > 0, got: " + factor);
        }
        sensitivityMultiplier *= factor;
    }

    // ---------------------------------------------------------------
    // Feedback log
    // ---------------------------------------------------------------

    public void appendFeedback(boolean useful) {
        feedbackLog.addLast(useful);
    }

    public int pendingFeedback() {
        return feedbackLog.size();
    }

    /**
     * Remove and return the oldest {@code count} feedback entries.
     *
     * @param count number of entries to consume
     * @return the consumed entries, oldest first
     */
    public List<Boolean> consumeFeedback(int count) {
        int n = Math.min(count, feedbackLog.size());
        List<Boolean> consumed = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            consumed.add(feedbackLog.pollFirst());
        }
        return consumed;
    }

    // ---------------------------------------------------------------
    // Recomputation bookkeeping
    // ---------------------------------------------------------------

    void countPoint() {
        pointsSinceCheck++;
    }

    long pointsSinceCheck() {
        return pointsSinceCheck;
    }

    Instant lastCheck() {
        return lastCheck;
    }

    void startCheckClock(Instant at) {
        lastCheck = at;
    }

    void markChecked(Instant at) {
        pointsSinceCheck = 0;
        lastCheck = at;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public MetricWindow getShortWindow() {
        return shortWindow;
    }

    public MetricWindow getLongWindow() {
        return longWindow;
    }

    /**
     * @return immutable copy of the committed threshold and its history
     */
    public ThresholdSnapshot snapshot() {
        return new ThresholdSnapshot(metricName, currentThreshold, sensitivityMultiplier, adjustmentHistory);
    }

    @Override
    public String toString() {
        return "ThresholdState{" +
                "metricName='" + metricName + '\'' +
                ", currentThreshold=" + currentThreshold +
                ", sensitivityMultiplier=" + sensitivityMultiplier +
                ", shortWindow=" + shortWindow +
                ", longWindow=" + longWindow +
                ", pendingFeedback=" + feedbackLog.size() +
                '}';
    }
}
