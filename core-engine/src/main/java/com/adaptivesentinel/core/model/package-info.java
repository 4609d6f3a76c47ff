/**
 * Value types shared between the threshold engine, its in-process pipeline
 * and the Flink job:
 * <ul>
 * <li>{@link com.adaptivesentinel.core.model.MetricPoint}: raw reading</li>
 * <li>{@link com.adaptivesentinel.core.model.AlertFeedback}: alert outcome</li>
 * <li>{@link com.adaptivesentinel.core.model.WindowStatistics}: window summary</li>
 * <li>{@link com.adaptivesentinel.core.model.ThresholdAdjustment}: history entry</li>
 * <li>{@link com.adaptivesentinel.core.model.ThresholdAlert}: threshold breach</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.model;
