package com.adaptivesentinel.core.threshold;

import java.time.Duration;
import java.util.Objects;

/**
 * Volume- or time-triggered {@link CheckPolicy}.
 */
final class PointsOrIntervalPolicy implements CheckPolicy {

    private static final long serialVersionUID = 1L;

    private final long points;
    private final Duration interval;

    PointsOrIntervalPolicy(long points, Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (points < 1) {
            throw new IllegalArgumentException("points must be >= 1, got: " + points);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got: " + interval);
        }
        this.points = points;
        this.interval = interval;
    }

    @Override
    public boolean shouldCheck(long pointsSinceCheck, Duration sinceLastCheck) {
        return pointsSinceCheck >= points || sinceLastCheck.compareTo(interval) >= 0;
    }

    @Override
    public String toString() {
        return "every " + points + " points or " + interval;
    }
}
