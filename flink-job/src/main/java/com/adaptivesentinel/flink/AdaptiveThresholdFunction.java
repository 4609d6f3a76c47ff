package com.adaptivesentinel.flink;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.feedback.FeedbackController;
import com.adaptivesentinel.core.model.AlertFeedback;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import com.adaptivesentinel.core.pipeline.BatchResult;
import com.adaptivesentinel.core.pipeline.MetricBatchProcessor;
import com.adaptivesentinel.core.threshold.ThresholdManager;
import com.adaptivesentinel.core.threshold.ThresholdState;
import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.co.KeyedCoProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flink host of the adaptive threshold engine.
 *
 * <p>
 * Input 1 carries metric points, input 2 alert feedback; both are keyed by
 * metric name, so each metric's {@link ThresholdState} has exactly one writer:
 * the operator instance owning its key.
 * </p>
 *
 * <h3>Batching</h3>
 * <p>
 * Points are buffered per key until {@code batchSize} of them arrived or
 * {@code batchTimeoutMs} of processing time passed since the first one, then
 * folded through the shared {@link MetricBatchProcessor}. Feedback first
 * folds the open batch, then applies.
 * </p>
 *
 * <h3>State Management</h3>
 * <ul>
 * <li>{@code ValueState<ThresholdState>} – windows, threshold, history,
 * sensitivity and feedback log of the metric</li>
 * <li>{@code ListState<MetricPoint>} – the open batch</li>
 * <li>{@code ValueState<Long>} – pending flush timer</li>
 * </ul>
 * <p>
 * All three are snapshotted in Flink checkpoints.
 * </p>
 *
 * <h3>Outputs</h3>
 * <p>
 * Main output: {@link ThresholdAlert}s. Side output {@link #ADJUSTMENTS}:
 * every committed {@link ThresholdAdjustment}.
 * </p>
 *
 * @since 1.0.0
 */
public class AdaptiveThresholdFunction
        extends KeyedCoProcessFunction<String, MetricPoint, AlertFeedback, ThresholdAlert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveThresholdFunction.class);

    /** Side output carrying every committed threshold change. */
    public static final OutputTag<ThresholdAdjustment> ADJUSTMENTS =
            new OutputTag<ThresholdAdjustment>("threshold-adjustments") {
            };

    private final EngineConfig config;
    private final ThresholdManager thresholdManager;
    private final MetricBatchProcessor batchProcessor;
    private final FeedbackController feedbackController;

    private transient ValueState<ThresholdState> thresholdState;
    private transient ListState<MetricPoint> pendingPoints;
    private transient ValueState<Long> flushTimer;

    private transient ThresholdMetrics metrics;

    /**
     * @param config validated engine configuration; must not be {@code null}
     */
    public AdaptiveThresholdFunction(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "Engine config must not be null");
        this.thresholdManager = new ThresholdManager(config);
        this.batchProcessor = new MetricBatchProcessor(thresholdManager);
        this.feedbackController = new FeedbackController(config);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        thresholdState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("threshold-state", TypeInformation.of(ThresholdState.class)));
        pendingPoints = getRuntimeContext().getListState(
                new ListStateDescriptor<>("pending-points", TypeInformation.of(MetricPoint.class)));
        flushTimer = getRuntimeContext().getState(
                new ValueStateDescriptor<>("flush-timer", Types.LONG));

        metrics = new ThresholdMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AdaptiveThresholdFunction opened: batchSize={}, batchTimeoutMs={}",
                config.getBatchSize(), config.getBatchTimeoutMs());
    }

    @Override
    public void close() {
        LOG.info("AdaptiveThresholdFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement1(MetricPoint point,
            KeyedCoProcessFunction<String, MetricPoint, AlertFeedback, ThresholdAlert>.Context ctx,
            Collector<ThresholdAlert> out) throws Exception {
        pendingPoints.add(point);

        if (flushTimer.value() == null) {
            long fireAt = ctx.timerService().currentProcessingTime() + config.getBatchTimeoutMs();
            ctx.timerService().registerProcessingTimeTimer(fireAt);
            flushTimer.update(fireAt);
        }

        List<MetricPoint> batch = pendingBatch();
        if (batch.size() >= config.getBatchSize()) {
            ctx.timerService().deleteProcessingTimeTimer(flushTimer.value());
            flush(batch, ctx, out);
        }
    }

    @Override
    public void processElement2(AlertFeedback feedback,
            KeyedCoProcessFunction<String, MetricPoint, AlertFeedback, ThresholdAlert>.Context ctx,
            Collector<ThresholdAlert> out) throws Exception {
        Long timer = flushTimer.value();
        if (timer != null) {
            ctx.timerService().deleteProcessingTimeTimer(timer);
            flush(pendingBatch(), ctx, out);
        }

        ThresholdState state = currentState(ctx.getCurrentKey());
        feedbackController.recordFeedback(state, feedback.wasUseful()).ifPresent(adjustment -> {
            ctx.output(ADJUSTMENTS, adjustment);
            metrics.incrementFeedbackAdjustments();
        });
        thresholdState.update(state);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedCoProcessFunction<String, MetricPoint, AlertFeedback, ThresholdAlert>.OnTimerContext ctx,
            Collector<ThresholdAlert> out) throws Exception {
        flush(pendingBatch(), ctx, out);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void flush(List<MetricPoint> batch,
            KeyedCoProcessFunction<String, MetricPoint, AlertFeedback, ThresholdAlert>.Context ctx,
            Collector<ThresholdAlert> out) throws Exception {
        pendingPoints.clear();
        flushTimer.clear();
        if (batch.isEmpty()) {
            return;
        }

        ThresholdState state = currentState(ctx.getCurrentKey());
        BatchResult result = batchProcessor.process(state, batch);
        thresholdState.update(state);

        for (ThresholdAlert alert : result.getAlerts()) {
            out.collect(alert);
            LOG.info("Alert fired: metric={} value={} threshold={}",
                    alert.getMetricName(), alert.getValue(), alert.getThreshold());
        }
        for (ThresholdAdjustment adjustment : result.getAdjustments()) {
            ctx.output(ADJUSTMENTS, adjustment);
        }

        metrics.recordBatch(result.getPoints().size());
        metrics.incrementAnomaliesDetected(result.getAlerts().size());
        metrics.incrementThresholdUpdates(result.getAdjustments().size());
    }

    private ThresholdState currentState(String metricName) throws Exception {
        ThresholdState state = thresholdState.value();
        if (state == null) {
            state = thresholdManager.newState(metricName);
            LOG.info("Tracking new metric '{}'", metricName);
        }
        return state;
    }

    private List<MetricPoint> pendingBatch() throws Exception {
        List<MetricPoint> batch = new ArrayList<>();
        Iterable<MetricPoint> pending = pendingPoints.get();
        if (pending != null) {
            pending.forEach(batch::add);
        }
        return batch;
    }
}
