package com.adaptivesentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deployment-wide tuning of the adaptive threshold engine.
 *
 * <p>
 * Expected YAML structure (every key is optional, defaults shown):
 * </p>
 *
 * <pre>
 * shortWindowSeconds: 1800
 * longWindowSeconds: 86400
 * batchSize: 100
 * batchTimeoutMs: 1000
 * queueCapacity: 10000
 * submitTimeoutMs: 0
 * gateThreshold: 0.10
 * volatilityMultiplier: 1.5
 * feedbackBatchSize: 10
 * desensitizeFactor: 1.1
 * sensitizeFactor: 0.9
 * falsePositiveHigh: 0.20
 * falsePositiveLow: 0.05
 * checkEveryPoints: 10
 * checkIntervalSeconds: 60
 * shutdownTimeoutMs: 5000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the values are usable.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Windows ---
    /** Span of the short (recent) window in seconds. */
    private long shortWindowSeconds = 1_800;

    /** Span of the long (historical) window in seconds. */
    private long longWindowSeconds = 86_400;

    // --- Ingestion ---
    /** Maximum number of points folded per batch. */
    private int batchSize = 100;

    /** Maximum time a batch stays open after its first point. */
    private long batchTimeoutMs = 1_000;

    /** Capacity of each metric's point queue. */
    private int queueCapacity = 10_000;

    /** How long {@code submit} waits for queue room; 0 fails immediately. */
    private long submitTimeoutMs = 0;

    /** How long {@code close} waits for workers to drain. */
    private long shutdownTimeoutMs = 5_000;

    // --- Threshold computation ---
    /** Minimum relative change before a recomputed threshold is committed. */
    private double gateThreshold = 0.10;

    /** Recent/historical volatility ratio above which the conservative branch is used. */
    private double volatilityMultiplier = 1.5;

    /** Recompute after this many points ... */
    private int checkEveryPoints = 10;

    /** ... or after this many seconds, whichever comes first. */
    private long checkIntervalSeconds = 60;

    // --- Feedback ---
    /** Number of feedback entries evaluated together. */
    private int feedbackBatchSize = 10;

    /** Threshold factor applied when too many alerts were not useful. */
    private double desensitizeFactor = 1.1;

    /** Threshold factor applied when almost every alert was useful. */
    private double sensitizeFactor = 0.9;

    /** False-positive rate above which the threshold is raised. */
    private double falsePositiveHigh = 0.20;

    /** False-positive rate below which the threshold is lowered. */
    private double falsePositiveLow = 0.05;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (shortWindowSeconds <= 0) {
            errors.add("'shortWindowSeconds' must be > 0, got: " + shortWindowSeconds);
        }
        if (longWindowSeconds <= 0) {
            errors.add("'longWindowSeconds' must be > 0, got: " + longWindowSeconds);
        }
        if (shortWindowSeconds > 0 && longWindowSeconds > 0 && shortWindowSeconds >= longWindowSeconds) {
            errors.add("'shortWindowSeconds' (" + shortWindowSeconds
                    + ") must be shorter than 'longWindowSeconds' (" + longWindowSeconds + ")");
        }
        if (batchSize < 1) {
            errors.add("'batchSize' must be >= 1, got: " + batchSize);
        }
        if (batchTimeoutMs < 1) {
            errors.add("'batchTimeoutMs' must be >= 1, got: " + batchTimeoutMs);
        }
        if (queueCapacity < 1) {
            errors.add("'queueCapacity' must be >= 1, got: " + queueCapacity);
        }
        if (submitTimeoutMs < 0) {
            errors.add("'submitTimeoutMs' must be >= 0, got: " + submitTimeoutMs);
        }
        if (shutdownTimeoutMs < 0) {
            errors.add("'shutdownTimeoutMs' must be >= 0, got: " + shutdownTimeoutMs);
        }
        if (gateThreshold < 0) {
            errors.add("'gateThreshold' must be >= 0, got: " + gateThreshold);
        }
        if (volatilityMultiplier <= 0) {
            errors.add("'volatilityMultiplier' must be > 0, got: " + volatilityMultiplier);
        }
        if (checkEveryPoints < 1) {
            errors.add("'checkEveryPoints' must be >= 1, got: " + checkEveryPoints);
        }
        if (checkIntervalSeconds < 1) {
            errors.add("'checkIntervalSeconds' must be >= 1, got: " + checkIntervalSeconds);
        }
        if (feedbackBatchSize < 1) {
            errors.add("'feedbackBatchSize' must be >= 1, got: " + feedbackBatchSize);
        }
        if (desensitizeFactor <= 1.0) {
            errors.add("'desensitizeFactor' must be > 1, got: " + desensitizeFactor);
        }
        if (sensitizeFactor <= 0 || sensitizeFactor >= 1.0) {
            errors.add("'sensitizeFactor' must be in (0, 1), got: " + sensitizeFactor);
        }
        if (falsePositiveLow < 0 || falsePositiveHigh > 1 || falsePositiveLow > falsePositiveHigh) {
            errors.add("false-positive bounds must satisfy 0 <= falsePositiveLow <= falsePositiveHigh <= 1, got: "
                    + falsePositiveLow + " / " + falsePositiveHigh);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public Duration shortWindow() {
        return Duration.ofSeconds(shortWindowSeconds);
    }

    public Duration longWindow() {
        return Duration.ofSeconds(longWindowSeconds);
    }

    public Duration batchTimeout() {
        return Duration.ofMillis(batchTimeoutMs);
    }

    public Duration checkInterval() {
        return Duration.ofSeconds(checkIntervalSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML during deserialization)
    // ---------------------------------------------------------------

    public long getShortWindowSeconds() {
        return shortWindowSeconds;
    }

    public void setShortWindowSeconds(long shortWindowSeconds) {
        this.shortWindowSeconds = shortWindowSeconds;
    }

    public long getLongWindowSeconds() {
        return longWindowSeconds;
    }

    public void setLongWindowSeconds(long longWindowSeconds) {
        this.longWindowSeconds = longWindowSeconds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getBatchTimeoutMs() {
        return batchTimeoutMs;
    }

    public void setBatchTimeoutMs(long batchTimeoutMs) {
        this.batchTimeoutMs = batchTimeoutMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getSubmitTimeoutMs() {
        return submitTimeoutMs;
    }

    public void setSubmitTimeoutMs(long submitTimeoutMs) {
        this.submitTimeoutMs = submitTimeoutMs;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public double getGateThreshold() {
        return gateThreshold;
    }

    public void setGateThreshold(double gateThreshold) {
        this.gateThreshold = gateThreshold;
    }

    public double getVolatilityMultiplier() {
        return volatilityMultiplier;
    }

    public void setVolatilityMultiplier(double volatilityMultiplier) {
        this.volatilityMultiplier = volatilityMultiplier;
    }

    public int getCheckEveryPoints() {
        return checkEveryPoints;
    }

    public void setCheckEveryPoints(int checkEveryPoints) {
        this.checkEveryPoints = checkEveryPoints;
    }

    public long getCheckIntervalSeconds() {
        return checkIntervalSeconds;
    }

    public void setCheckIntervalSeconds(long checkIntervalSeconds) {
        this.checkIntervalSeconds = checkIntervalSeconds;
    }

    public int getFeedbackBatchSize() {
        return feedbackBatchSize;
    }

    public void setFeedbackBatchSize(int feedbackBatchSize) {
        this.feedbackBatchSize = feedbackBatchSize;
    }

    public double getDesensitizeFactor() {
        return desensitizeFactor;
    }

    public void setDesensitizeFactor(double desensitizeFactor) {
        this.desensitizeFactor = desensitizeFactor;
    }

    public double getSensitizeFactor() {
        return sensitizeFactor;
    }

    public void setSensitizeFactor(double sensitizeFactor) {
        this.sensitizeFactor = sensitizeFactor;
    }

    public double getFalsePositiveHigh() {
        return falsePositiveHigh;
    }

    public void setFalsePositiveHigh(double falsePositiveHigh) {
        this.falsePositiveHigh = falsePositiveHigh;
    }

    public double getFalsePositiveLow() {
        return falsePositiveLow;
    }

    public void setFalsePositiveLow(double falsePositiveLow) {
        this.falsePositiveLow = falsePositiveLow;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "shortWindowSeconds=" + shortWindowSeconds +
                ", longWindowSeconds=" + longWindowSeconds +
                ", batchSize=" + batchSize +
                ", batchTimeoutMs=" + batchTimeoutMs +
                ", queueCapacity=" + queueCapacity +
                ", submitTimeoutMs=" + submitTimeoutMs +
                ", shutdownTimeoutMs=" + shutdownTimeoutMs +
                ", gateThreshold=" + gateThreshold +
                ", volatilityMultiplier=" + volatilityMultiplier +
                ", checkEveryPoints=" + checkEveryPoints +
                ", checkIntervalSeconds=" + checkIntervalSeconds +
                ", feedbackBatchSize=" + feedbackBatchSize +
                ", desensitizeFactor=" + desensitizeFactor +
                ", sensitizeFactor=" + sensitizeFactor +
                ", falsePositiveHigh=" + falsePositiveHigh +
                ", falsePositiveLow=" + falsePositiveLow +
                '}';
    }
}
