package com.adaptivesentinel.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable deployment configuration for the Adaptive Sentinel Flink
 * job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through Kubernetes Deployment env vars, Docker
 * {@code -e} flags or a shell environment. Engine tuning (windows, gate,
 * feedback bounds) lives in the engine YAML referenced by
 * {@link #getEngineConfigPath()}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String metricsTopic;
    private final String feedbackTopic;
    private final String alertsTopic;
    private final String adjustmentsTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final String engineConfigPath;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.metricsTopic = b.metricsTopic;
        this.feedbackTopic = b.feedbackTopic;
        this.alertsTopic = b.alertsTopic;
        this.adjustmentsTopic = b.adjustmentsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.engineConfigPath = b.engineConfigPath;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric env-var cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .metricsTopic(env("KAFKA_METRICS_TOPIC", "metrics"))
                    .feedbackTopic(env("KAFKA_FEEDBACK_TOPIC", "alert-feedback"))
                    .alertsTopic(env("KAFKA_ALERTS_TOPIC", "threshold-alerts"))
                    .adjustmentsTopic(env("KAFKA_ADJUSTMENTS_TOPIC", "threshold-adjustments"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "adaptive-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getMetricsTopic() {
        return metricsTopic;
    }

    public String getFeedbackTopic() {
        return feedbackTopic;
    }

    public String getAlertsTopic() {
        return alertsTopic;
    }

    public String getAdjustmentsTopic() {
        return adjustmentsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return path of the engine YAML, or an empty string to use the
     *         classpath / built-in defaults
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, non-blank and
     * distinct topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String metricsTopic = "metrics";
        private String feedbackTopic = "alert-feedback";
        private String alertsTopic = "threshold-alerts";
        private String adjustmentsTopic = "threshold-adjustments";
        private String kafkaGroupId = "adaptive-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String engineConfigPath = "";

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder metricsTopic(String v) {
            this.metricsTopic = v;
            return this;
        }

        public Builder feedbackTopic(String v) {
            this.feedbackTopic = v;
            return this;
        }

        public Builder alertsTopic(String v) {
            this.alertsTopic = v;
            return this;
        }

        public Builder adjustmentsTopic(String v) {
            this.adjustmentsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(engineConfigPath, "engineConfigPath required (may be empty)");
            requireNonBlank(metricsTopic, "metricsTopic");
            requireNonBlank(feedbackTopic, "feedbackTopic");
            requireNonBlank(alertsTopic, "alertsTopic");
            requireNonBlank(adjustmentsTopic, "adjustmentsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (metricsTopic.equals(feedbackTopic)) {
                throw new IllegalArgumentException(
                        "metricsTopic and feedbackTopic must differ, both are: " + metricsTopic);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", metricsTopic='" + metricsTopic + '\'' +
                ", feedbackTopic='" + feedbackTopic + '\'' +
                ", alertsTopic='" + alertsTopic + '\'' +
                ", adjustmentsTopic='" + adjustmentsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                '}';
    }
}
