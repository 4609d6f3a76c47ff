package com.adaptivesentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metric definitions for the threshold operator.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The reporter is configured in {@code flink-conf.yaml} at cluster level; the
 * job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code points_processed_total} – metric points folded into state</li>
 *   <li>{@code anomalies_detected_total} – threshold alerts emitted</li>
 *   <li>{@code threshold_updates_total} – recomputed thresholds committed</li>
 *   <li>{@code feedback_adjustments_total} – feedback-driven changes</li>
 *   <li>{@code batch_size} – histogram of folded batch sizes</li>
 * </ul>
 */
public class ThresholdMetrics {

    private final Counter pointsProcessed;
    private final Counter anomaliesDetected;
    private final Counter thresholdUpdates;
    private final Counter feedbackAdjustments;
    private final Histogram batchSize;

    public ThresholdMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("adaptive_sentinel");

        this.pointsProcessed = group.counter("points_processed_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.thresholdUpdates = group.counter("threshold_updates_total");
        this.feedbackAdjustments = group.counter("feedback_adjustments_total");

        // sliding window of the last 350 batches
        this.batchSize = group.histogram("batch_size", new DescriptiveStatisticsHistogram(350));
    }

    public void recordBatch(int points) {
        pointsProcessed.inc(points);
        batchSize.update(points);
    }

    public void incrementAnomaliesDetected(int count) {
        anomaliesDetected.inc(count);
    }

    public void incrementThresholdUpdates(int count) {
        thresholdUpdates.inc(count);
    }

    public void incrementFeedbackAdjustments() {
        feedbackAdjustments.inc();
    }
}
