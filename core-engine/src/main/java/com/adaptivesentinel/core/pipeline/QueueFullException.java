package com.adaptivesentinel.core.pipeline;

/**
 * Backpressure signal: a metric's point queue is at capacity.
 *
 * <p>
 * The submitter decides whether to drop, retry or slow down; the pipeline
 * never drops a point silently.
 * </p>
 *
 * @since 1.0.0
 */
public class QueueFullException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final int capacity;

    public QueueFullException(String metricName, int capacity) {
        super("Queue for metric '" + metricName + "' is full (capacity " + capacity + ")");
        this.metricName = metricName;
        this.capacity = capacity;
    }

    public String getMetricName() {
        return metricName;
    }

    public int getCapacity() {
        return capacity;
    }
}
