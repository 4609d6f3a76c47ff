package com.adaptivesentinel.core.pipeline;

import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;

/**
 * Receives engine output from the pipeline workers.
 *
 * <p>
 * Callbacks run on the worker thread of the metric concerned and must not
 * block for long. Exceptions are logged and do not stop the worker.
 * </p>
 *
 * @since 1.0.0
 */
public interface EngineListener {

    /** Listener that ignores everything. */
    EngineListener NO_OP = new EngineListener() {
    };

    /**
     * Called after a metric's committed threshold changed.
     *
     * @param adjustment the recorded change
     */
    default void onThresholdChanged(ThresholdAdjustment adjustment) {
    }

    /**
     * Called for every reading that exceeded its metric's committed threshold.
     *
     * @param alert the breach
     */
    default void onAnomaly(ThresholdAlert alert) {
    }
}
