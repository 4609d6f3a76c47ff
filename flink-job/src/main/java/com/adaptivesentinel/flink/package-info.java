/**
 * Apache Flink streaming host for the adaptive threshold engine.
 *
 * <p>
 * This package wires the core engine into a Flink pipeline that consumes
 * metric points and alert feedback from Kafka, keeps per-metric threshold
 * state in keyed state, and publishes alerts and threshold adjustments back
 * to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.adaptivesentinel.flink.AdaptiveSentinelJob}: main entry
 * point</li>
 * <li>{@link com.adaptivesentinel.flink.AdaptiveThresholdFunction}: keyed
 * co-process function</li>
 * <li>{@link com.adaptivesentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.flink;
