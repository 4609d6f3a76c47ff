package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.feedback.FeedbackController;
import com.adaptivesentinel.core.model.AlertFeedback;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.threshold.CheckPolicy;
import com.adaptivesentinel.core.threshold.ThresholdManager;
import com.adaptivesentinel.core.threshold.ThresholdSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Supervising registry and entry point of the in-process threshold engine.
 *
 * <h3>Workers</h3>
 * <p>
 * Every metric name gets its own {@link MetricWorker}, created on the first
 * point or feedback for that name and running on a dedicated thread. The
 * worker owns the metric's {@link com.adaptivesentinel.core.threshold.ThresholdState}
 * and queue; nothing else writes to them.
 * </p>
 *
 * <h3>Reads</h3>
 * <p>
 * {@link #getThreshold(String)}, {@link #getAdjustmentHistory(String)} and
 * {@link #isAnomalous(String, double)} read an immutable snapshot the worker
 * publishes after each change. They never block a worker and never create
 * state for unknown metrics.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #retire(String)} stops one metric after draining it;
 * {@link #close()} stops accepting input, then drains every metric.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestionPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(IngestionPipeline.class);

    private final EngineConfig config;
    private final ThresholdManager thresholdManager;
    private final MetricBatchProcessor batchProcessor;
    private final FeedbackController feedbackController;
    private final EngineListener listener;
    private final BatchSink batchSink;

    private final Map<String, MetricWorker> workers = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    /** Read side: submitters. Write side: lifecycle changes. */
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private volatile boolean accepting = true;

    private IngestionPipeline(Builder builder) {
        this.config = builder.config;
        this.thresholdManager = new ThresholdManager(config, builder.checkPolicy, builder.clock);
        this.batchProcessor = new MetricBatchProcessor(thresholdManager);
        this.feedbackController = new FeedbackController(config, builder.clock);
        this.listener = builder.listener;
        this.batchSink = builder.batchSink;
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        LOG.info("Ingestion pipeline started: {}", config);
    }

    /**
     * @param config validated engine configuration; must not be {@code null}
     * @return builder for a pipeline using {@code config}
     */
    public static Builder builder(EngineConfig config) {
        return new Builder(config);
    }

    // ---------------------------------------------------------------
    // Input
    // ---------------------------------------------------------------

    /**
     * Enqueue a reading for its metric.
     *
     * @param point the reading; must not be {@code null}
     * @throws QueueFullException    if the metric's queue stays full for
     *                               {@code submitTimeoutMs}
     * @throws IllegalStateException if the pipeline is closed
     */
    public void submit(MetricPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        lifecycleLock.readLock().lock();
        try {
            ensureAccepting();
            worker(point.getMetricName()).offer(point, config.getSubmitTimeoutMs());
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * Deliver an alert outcome to the worker owning its metric.
     *
     * @param feedback the outcome; must not be {@code null}
     * @throws IllegalStateException if the pipeline is closed
     */
    public void recordFeedback(AlertFeedback feedback) {
        Objects.requireNonNull(feedback, "feedback must not be null");
        lifecycleLock.readLock().lock();
        try {
            ensureAccepting();
            worker(feedback.getMetricName()).deliverFeedback(feedback.wasUseful());
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    /**
     * @see #recordFeedback(AlertFeedback)
     */
    public void recordFeedback(String metricName, boolean wasUseful) {
        recordFeedback(new AlertFeedback(metricName, wasUseful));
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return the committed threshold, or {@code 0} if none yet
     */
    public double getThreshold(String metricName) {
        return getSnapshot(metricName).map(ThresholdSnapshot::getCurrentThreshold).orElse(0.0);
    }

    /**
     * @return adjustment history, oldest first; empty for unknown metrics
     */
    public List<ThresholdAdjustment> getAdjustmentHistory(String metricName) {
        return getSnapshot(metricName).map(ThresholdSnapshot::getAdjustmentHistory).orElse(List.of());
    }

    /**
     * @return {@code true} if {@code value} exceeds the metric's committed threshold
     */
    public boolean isAnomalous(String metricName, double value) {
        return getSnapshot(metricName).map(s -> s.isAnomalous(value)).orElse(false);
    }

    /**
     * @return latest published view of the metric, or empty if it is unknown
     */
    public Optional<ThresholdSnapshot> getSnapshot(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        MetricWorker worker = workers.get(metricName);
        return worker != null ? Optional.of(worker.snapshot()) : Optional.empty();
    }

    /**
     * @return names of all live metrics
     */
    public Set<String> metricNames() {
        return Set.copyOf(workers.keySet());
    }

    /**
     * @return points waiting in the metric's queue (0 for unknown metrics)
     */
    public int queuedPoints(String metricName) {
        MetricWorker worker = workers.get(metricName);
        return worker != null ? worker.queuedPoints() : 0;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Stop a metric's worker after it has folded everything queued, and drop
     * its state.
     *
     * @param metricName the metric to retire
     * @return {@code false} if the metric was unknown
     */
    public boolean retire(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        MetricWorker worker;
        lifecycleLock.writeLock().lock();
        try {
            worker = workers.remove(metricName);
            if (worker == null) {
                return false;
            }
            worker.stop();
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        try {
            if (!worker.awaitTermination(config.getShutdownTimeoutMs())) {
                LOG.warn("Worker for metric '{}' did not finish within {} ms",
                        metricName, config.getShutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Retired metric '{}'", metricName);
        return true;
    }

    /**
     * Stop accepting input, then let every worker drain and finish.
     */
    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (!accepting) {
                return;
            }
            accepting = false;
            workers.values().forEach(MetricWorker::stop);
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Workers did not drain within {} ms, interrupting", config.getShutdownTimeoutMs());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Ingestion pipeline stopped ({} metric(s))", workers.size());
    }

    public boolean isAccepting() {
        return accepting;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void ensureAccepting() {
        if (!accepting) {
            throw new IllegalStateException("Ingestion pipeline is closed");
        }
    }

    private MetricWorker worker(String metricName) {
        return workers.computeIfAbsent(metricName, this::startWorker);
    }

    private MetricWorker startWorker(String metricName) {
        MetricWorker worker = new MetricWorker(
                metricName,
                thresholdManager.newState(metricName),
                batchProcessor,
                feedbackController,
                listener,
                batchSink,
                config.getBatchSize(),
                config.getBatchTimeoutMs(),
                config.getQueueCapacity());
        executor.execute(worker);
        LOG.info("Started worker for metric '{}'", metricName);
        return worker;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "threshold-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link IngestionPipeline}.
     *
     * <p>
     * Only the configuration is required. Defaults: the configured
     * points-or-interval check policy, the system UTC clock, no listener and
     * a discarding batch sink.
     * </p>
     */
    public static class Builder {
        private final EngineConfig config;
        private CheckPolicy checkPolicy;
        private Clock clock = Clock.systemUTC();
        private EngineListener listener = EngineListener.NO_OP;
        private BatchSink batchSink = BatchSink.discarding();

        private Builder(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            this.checkPolicy = CheckPolicy.everyPointsOrInterval(
                    config.getCheckEveryPoints(), config.checkInterval());
        }

        public Builder checkPolicy(CheckPolicy checkPolicy) {
            this.checkPolicy = Objects.requireNonNull(checkPolicy, "checkPolicy must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder listener(EngineListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        public Builder batchSink(BatchSink batchSink) {
            this.batchSink = Objects.requireNonNull(batchSink, "batchSink must not be null");
            return this;
        }

        /**
         * Validate the configuration and start the pipeline.
         *
         * @return a running pipeline
         * @throws IllegalStateException if the configuration is invalid
         */
        public IngestionPipeline build() {
            config.validate();
            return new IngestionPipeline(this);
        }
    }
}
