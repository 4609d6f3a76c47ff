package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.feedback.FeedbackController;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import com.adaptivesentinel.core.threshold.ThresholdSnapshot;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Single writer for one metric.
 *
 * <h3>Mailbox</h3>
 * <p>
 * Points, feedback and the stop signal share one FIFO mailbox, so feedback
 * and recomputation are serialized on this worker. Feedback closes the open
 * batch first, so it always sees every point submitted before it. Only points count
 * against the queue capacity; a {@link Semaphore} holds one permit per free
 * slot and is released when the worker takes a point off the mailbox.
 * </p>
 *
 * <h3>Batch assembly</h3>
 * <p>
 * A batch closes when it holds {@code batchSize} points or when
 * {@code batchTimeout} has passed since its first point. Stopping (or
 * interrupting) the worker flushes the open batch and anything still queued.
 * </p>
 */
final class MetricWorker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MetricWorker.class);

    private final String metricName;
    private final ThresholdState state;
    private final MetricBatchProcessor processor;
    private final FeedbackController feedbackController;
    private final EngineListener listener;
    private final BatchSink batchSink;
    private final int batchSize;
    private final long batchTimeoutNanos;
    private final int capacity;

    private final BlockingQueue<Message> mailbox = new LinkedBlockingQueue<>();
    private final Semaphore freeSlots;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile ThresholdSnapshot snapshot;

    MetricWorker(String metricName, ThresholdState state, MetricBatchProcessor processor,
            FeedbackController feedbackController, EngineListener listener, BatchSink batchSink,
            int batchSize, long batchTimeoutMs, int capacity) {
        this.metricName = metricName;
        this.state = state;
        this.processor = processor;
        this.feedbackController = feedbackController;
        this.listener = listener;
        this.batchSink = batchSink;
        this.batchSize = batchSize;
        this.batchTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(batchTimeoutMs);
        this.capacity = capacity;
        this.freeSlots = new Semaphore(capacity);
        this.snapshot = state.snapshot();
    }

    // ---------------------------------------------------------------
    // Producer side (any thread)
    // ---------------------------------------------------------------

    /**
     * @throws QueueFullException if no slot frees up within {@code timeoutMs}
     */
    void offer(MetricPoint point, long timeoutMs) {
        boolean acquired;
        try {
            acquired = timeoutMs > 0
                    ? freeSlots.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)
                    : freeSlots.tryAcquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for queue room for metric '"
                    + metricName + "'", e);
        }
        if (!acquired) {
            throw new QueueFullException(metricName, capacity);
        }
        mailbox.add(Message.point(point));
    }

    void deliverFeedback(boolean useful) {
        mailbox.add(Message.feedback(useful));
    }

    void stop() {
        mailbox.add(Message.STOP);
    }

    boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return terminated.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    ThresholdSnapshot snapshot() {
        return snapshot;
    }

    int queuedPoints() {
        return capacity - freeSlots.availablePermits();
    }

    // ---------------------------------------------------------------
    // Worker loop
    // ---------------------------------------------------------------

    @Override
    public void run() {
        List<MetricPoint> batch = new ArrayList<>(batchSize);
        long deadline = 0;
        try {
            while (true) {
                Message message;
                if (batch.isEmpty()) {
                    message = mailbox.take();
                } else {
                    message = mailbox.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                }

                if (message == null) {
                    flush(batch);
                    continue;
                }

                switch (message.kind) {
                    case POINT -> {
                        freeSlots.release();
                        if (batch.isEmpty()) {
                            deadline = System.nanoTime() + batchTimeoutNanos;
                        }
                        batch.add(message.point);
                        if (batch.size() >= batchSize) {
                            flush(batch);
                        }
                    }
                    case FEEDBACK -> {
                        flush(batch);
                        applyFeedback(message.useful);
                    }
                    case STOP -> {
                        flush(batch);
                        LOG.debug("Worker for metric '{}' stopped", metricName);
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Worker for metric '{}' interrupted, draining {} queued message(s)",
                    metricName, mailbox.size());
            drain(batch);
        } finally {
            terminated.countDown();
        }
    }

    private void drain(List<MetricPoint> batch) {
        List<Message> remaining = new ArrayList<>();
        mailbox.drainTo(remaining);
        for (Message message : remaining) {
            if (message.kind == Kind.POINT) {
                freeSlots.release();
                batch.add(message.point);
            } else if (message.kind == Kind.FEEDBACK) {
                flush(batch);
                applyFeedback(message.useful);
            }
        }
        flush(batch);
    }

    private void flush(List<MetricPoint> batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<MetricPoint> points = List.copyOf(batch);
        batch.clear();

        BatchResult result;
        try {
            result = processor.process(state, points);
        } catch (RuntimeException e) {
            LOG.error("Failed to fold batch of {} point(s) for metric '{}'", points.size(), metricName, e);
            return;
        }

        if (!result.getAdjustments().isEmpty()) {
            snapshot = state.snapshot();
            result.getAdjustments().forEach(this::notifyThresholdChanged);
        }
        result.getAlerts().forEach(this::notifyAnomaly);

        try {
            batchSink.accept(metricName, result.getPoints());
        } catch (RuntimeException e) {
            LOG.error("Batch sink failed for metric '{}' ({} point(s))", metricName, points.size(), e);
        }
    }

    private void applyFeedback(boolean useful) {
        feedbackController.recordFeedback(state, useful).ifPresent(adjustment -> {
            snapshot = state.snapshot();
            notifyThresholdChanged(adjustment);
        });
    }

    private void notifyThresholdChanged(ThresholdAdjustment adjustment) {
        try {
            listener.onThresholdChanged(adjustment);
        } catch (RuntimeException e) {
            LOG.error("Listener failed on threshold change for metric '{}'", metricName, e);
        }
    }

    private void notifyAnomaly(ThresholdAlert alert) {
        try {
            listener.onAnomaly(alert);
        } catch (RuntimeException e) {
            LOG.error("Listener failed on anomaly for metric '{}'", metricName, e);
        }
    }

    // ---------------------------------------------------------------
    // Mailbox messages
    // ---------------------------------------------------------------

    private enum Kind {
        POINT, FEEDBACK, STOP
    }

    private static final class Message {

        static final Message STOP = new Message(Kind.STOP, null, false);

        final Kind kind;
        final MetricPoint point;
        final boolean useful;

        private Message(Kind kind, MetricPoint point, boolean useful) {
            this.kind = kind;
            this.point = point;
            this.useful = useful;
        }

        static Message point(MetricPoint point) {
            return new Message(Kind.POINT, point, false);
        }

        static Message feedback(boolean useful) {
            return new Message(Kind.FEEDBACK, null, useful);
        }
    }
}
