package com.adaptivesentinel.core.threshold;

import java.io.Serializable;
import java.time.Duration;

/**
 * Decides when a metric's threshold should be recomputed.
 *
 * <p>
 * Consulted by {@link ThresholdManager#maybeUpdate(ThresholdState)} after
 * every point folded into a metric's windows. Implementations must be
 * {@link Serializable} because the Flink job ships them with its operator.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckPolicy extends Serializable {

    /**
     * @param pointsSinceCheck points added since the last recomputation
     * @param sinceLastCheck   time elapsed since the last recomputation
     * @return {@code true} to recompute now
     */
    boolean shouldCheck(long pointsSinceCheck, Duration sinceLastCheck);

    /**
     * Recompute after every point.
     *
     * @return a policy that always fires
     */
    static CheckPolicy always() {
        return (points, elapsed) -> true;
    }

    /**
     * Recompute once {@code points} points have arrived or {@code interval}
     * has passed since the last recomputation, whichever comes first.
     *
     * @param points   point budget; must be &gt;= 1
     * @param interval time budget; must be positive
     * @return the hybrid policy
     * @throws IllegalArgumentException if either bound is invalid
     */
    static CheckPolicy everyPointsOrInterval(long points, Duration interval) {
        return new PointsOrIntervalPolicy(points, interval);
    }
}
