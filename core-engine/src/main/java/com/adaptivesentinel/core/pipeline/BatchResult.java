package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;

import java.util.List;

/**
 * Outcome of folding one batch into a metric's state.
 *
 * @since 1.0.0
 */
public final class BatchResult {

    private final List<MetricPoint> points;
    private final List<ThresholdAlert> alerts;
    private final List<ThresholdAdjustment> adjustments;

    BatchResult(List<MetricPoint> points, List<ThresholdAlert> alerts, List<ThresholdAdjustment> adjustments) {
        this.points = List.copyOf(points);
        this.alerts = List.copyOf(alerts);
        this.adjustments = List.copyOf(adjustments);
    }

    /**
     * @return the batch in the order it was folded (timestamp order)
     */
    public List<MetricPoint> getPoints() {
        return points;
    }

    public List<ThresholdAlert> getAlerts() {
        return alerts;
    }

    public List<ThresholdAdjustment> getAdjustments() {
        return adjustments;
    }
}
