package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import com.adaptivesentinel.core.threshold.ThresholdManager;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Folds an assembled batch into a metric's {@link ThresholdState}.
 *
 * <h3>Per point, in timestamp order</h3>
 * <ol>
 * <li>Compare against the threshold committed so far; emit a
 * {@link ThresholdAlert} if it is exceeded.</li>
 * <li>Add the point to both windows.</li>
 * <li>Let the {@link ThresholdManager} recompute if its check policy
 * fires.</li>
 * </ol>
 *
 * <p>
 * Shared by the in-process {@link IngestionPipeline} workers and the Flink
 * operator, so both produce the same outputs for the same input.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricBatchProcessor implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricBatchProcessor.class);

    private final ThresholdManager thresholdManager;

    public MetricBatchProcessor(ThresholdManager thresholdManager) {
        this.thresholdManager = Objects.requireNonNull(thresholdManager, "thresholdManager must not be null");
    }

    /**
     * @param state the metric's state; mutated in place
     * @param batch points of that metric in arrival order
     * @return the batch as folded plus any alerts and adjustments it produced
     * @throws IllegalArgumentException if a point belongs to another metric
     */
    public BatchResult process(ThresholdState state, List<MetricPoint> batch) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(batch, "batch must not be null");

        List<MetricPoint> ordered = new ArrayList<>(batch);
        ordered.sort(MetricPoint.BY_TIMESTAMP);

        List<ThresholdAlert> alerts = new ArrayList<>();
        List<ThresholdAdjustment> adjustments = new ArrayList<>();

        for (MetricPoint point : ordered) {
            if (!state.getMetricName().equals(point.getMetricName())) {
                throw new IllegalArgumentException("Point for '" + point.getMetricName()
                        + "' in batch of '" + state.getMetricName() + "'");
            }

            if (thresholdManager.isAnomalous(state, point.getValue())) {
                double threshold = state.getCurrentThreshold();
                LOG.debug("Metric [{}] breach: value={} > threshold={}",
                        point.getMetricName(), point.getValue(), threshold);
                alerts.add(ThresholdAlert.builder()
                        .metricName(point.getMetricName())
                        .value(point.getValue())
                        .threshold(threshold)
                        .timestamp(point.getTimestamp())
                        .details(String.format(Locale.ROOT,
                                "Threshold exceeded: %s=%.2f (threshold: %.2f)",
                                point.getMetricName(), point.getValue(), threshold))
                        .build());
            }

            thresholdManager.addMetric(state, point.getValue(), point.getTimestamp());
            thresholdManager.maybeUpdate(state).ifPresent(adjustments::add);
        }

        LOG.trace("Metric [{}]: folded {} point(s), {} alert(s), {} adjustment(s)",
                state.getMetricName(), ordered.size(), alerts.size(), adjustments.size());
        return new BatchResult(ordered, alerts, adjustments);
    }
}
