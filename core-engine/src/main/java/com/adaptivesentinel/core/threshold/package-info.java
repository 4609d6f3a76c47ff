/**
 * Adaptive threshold model.
 *
 * <p>
 * {@link com.adaptivesentinel.core.threshold.ThresholdManager} applies the
 * dual-window rule of
 * {@link com.adaptivesentinel.core.threshold.ThresholdCalculator} to a
 * metric's {@link com.adaptivesentinel.core.threshold.ThresholdState},
 * gates the result through a relative-change hysteresis and records every
 * commit. When to recompute is left to a
 * {@link com.adaptivesentinel.core.threshold.CheckPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
package com.adaptivesentinel.core.threshold;
