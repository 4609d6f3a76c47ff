package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.model.MetricPoint;

import java.util.List;

/**
 * Downstream buffer for assembled batches (storage, batch analysis).
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchSink {

    /**
     * @param metricName metric the batch belongs to
     * @param batch      points in timestamp order (unmodifiable)
     */
    void accept(String metricName, List<MetricPoint> batch);

    /**
     * @return a sink that drops every batch
     */
    static BatchSink discarding() {
        return (metricName, batch) -> {
        };
    }
}
