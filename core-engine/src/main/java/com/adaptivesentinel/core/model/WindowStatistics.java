package com.adaptivesentinel.core.model;

import java.io.Serializable;

/**
 * Summary statistics over the points currently retained by a metric window.
 *
 * <p>
 * {@code std} is the population standard deviation. Percentiles use linear
 * interpolation between closest ranks.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int count;
    private final double mean;
    private final double std;
    private final double median;
    private final double p95;
    private final double p99;

    public WindowStatistics(int count, double mean, double std, double median, double p95, double p99) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.median = median;
        this.p95 = p95;
        this.p99 = p99;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMedian() {
        return median;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    @Override
    public String toString() {
        return "WindowStatistics{" +
                "count=" + count +
                ", mean=" + mean +
                ", std=" + std +
                ", median=" + median +
                ", p95=" + p95 +
                ", p99=" + p99 +
                '}';
    }
}
