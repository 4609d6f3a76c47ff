/**
 * Per-metric ingestion: bounded queues, batch assembly and the worker that
 * owns each metric's threshold state.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.adaptivesentinel.core.pipeline.IngestionPipeline}: registry,
 * input, queries and lifecycle</li>
 * <li>{@link com.adaptivesentinel.core.pipeline.MetricBatchProcessor}: folds a
 * batch into a metric's state (also used by the Flink job)</li>
 * <li>{@link com.adaptivesentinel.core.pipeline.EngineListener} and
 * {@link com.adaptivesentinel.core.pipeline.BatchSink}: outputs</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.pipeline;
