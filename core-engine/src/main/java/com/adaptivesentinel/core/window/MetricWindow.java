package com.adaptivesentinel.core.window;

import com.adaptivesentinel.core.model.WindowStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

/**
 * Time-bounded buffer of {@code (timestamp, value)} samples for one metric.
 *
 * <h3>Eviction</h3>
 * <p>
 * Every retained sample satisfies
 * {@code latestTimestamp - sample.timestamp <= capacity}. Eviction is lazy:
 * it runs on {@link #addPoint(double, Instant)} and pops from the oldest end,
 * so each sample is evicted at most once.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Samples are kept in timestamp order. A late sample that is still inside
 * the horizon is inserted at its position; a sample older than
 * {@code latestTimestamp - capacity} is discarded.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Not thread-safe. A window belongs to exactly one
 * {@link com.adaptivesentinel.core.threshold.ThresholdState}, which is only
 * touched by the worker that owns the metric.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricWindow implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricWindow.class);

    private final Duration capacity;

    /** Samples in ascending timestamp order. */
    private final Deque<Sample> samples = new ArrayDeque<>();

    /**
     * @param capacity span of time the window covers; must be positive
     * @throws IllegalArgumentException if {@code capacity} is zero or negative
     */
    public MetricWindow(Duration capacity) {
        Objects.requireNonNull(capacity, "capacity must not be null");
        if (capacity.isZero() || capacity.isNegative()) {
            throw new IllegalArgumentException("Window capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Record a sample and evict everything that fell out of the window.
     *
     * @param value     observed value
     * @param timestamp generation time of the sample; must not be {@code null}
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public void addPoint(double value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite, got: " + value);
        }

        Sample newest = samples.peekLast();
        if (newest == null || !timestamp.isBefore(newest.timestamp)) {
            samples.addLast(new Sample(timestamp, value));
        } else if (isExpired(timestamp, newest.timestamp)) {
            LOG.trace("Discarding sample at {}: older than window of {} ending {}",
                    timestamp, capacity, newest.timestamp);
            return;
        } else {
            insertLate(new Sample(timestamp, value));
        }

        Instant latest = samples.peekLast().timestamp;
        while (isExpired(samples.peekFirst().timestamp, latest)) {
            samples.pollFirst();
        }
    }

    /**
     * Compute summary statistics over the retained samples.
     *
     * @return mean, population standard deviation, median, p95 and p99
     * @throws EmptyWindowException if the window holds no samples
     */
    public WindowStatistics statistics() {
        if (samples.isEmpty()) {
            throw new EmptyWindowException("No samples in window of " + capacity);
        }

        double[] sorted = values();
        Arrays.sort(sorted);
        int n = sorted.length;

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;

        double sumSquaredDiff = 0;
        for (double v : sorted) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        double std = Math.sqrt(sumSquaredDiff / n);

        return new WindowStatistics(n, mean, std,
                percentile(sorted, 50), percentile(sorted, 95), percentile(sorted, 99));
    }

    /**
     * Linear-interpolated percentile of an ascending array.
     *
     * <p>
     * The rank is {@code p / 100 * (n - 1)}; the result interpolates between
     * the values at the two surrounding integer ranks.
     * </p>
     *
     * @param sorted ascending, non-empty values
     * @param p      percentile in {@code [0, 100]}
     * @return the interpolated percentile
     */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Duration capacity() {
        return capacity;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /**
     * @return timestamp of the newest retained sample, or {@code null} if empty
     */
    public Instant latestTimestamp() {
        Sample newest = samples.peekLast();
        return newest != null ? newest.timestamp : null;
    }

    /**
     * @return timestamp of the oldest retained sample, or {@code null} if empty
     */
    public Instant oldestTimestamp() {
        Sample oldest = samples.peekFirst();
        return oldest != null ? oldest.timestamp : null;
    }

    /**
     * @return copy of the retained values in timestamp order
     */
    public double[] values() {
        double[] values = new double[samples.size()];
        int i = 0;
        for (Sample sample : samples) {
            values[i++] = sample.value;
        }
        return values;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean isExpired(Instant timestamp, Instant latest) {
        return Duration.between(timestamp, latest).compareTo(capacity) > 0;
    }

    private void insertLate(Sample late) {
        Deque<Sample> newer = new ArrayDeque<>();
        while (!samples.isEmpty() && samples.peekLast().timestamp.isAfter(late.timestamp)) {
            newer.addFirst(samples.pollLast());
        }
        samples.addLast(late);
        samples.addAll(newer);
    }

    private static final class Sample implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant timestamp;
        private final double value;

        private Sample(Instant timestamp, double value) {
            this.timestamp = timestamp;
            this.value = value;
        }
    }

    @Override
    public String toString() {
        return "MetricWindow{capacity=" + capacity + ", size=" + samples.size() + '}';
    }
}
