package com.adaptivesentinel.flink;

import com.adaptivesentinel.core.config.EngineConfig;
import com.adaptivesentinel.core.config.EngineConfigLoader;
import com.adaptivesentinel.core.model.AlertFeedback;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Adaptive Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (metrics topic)          Kafka (feedback topic)
 *     → JSON → MetricPoint           → JSON → AlertFeedback
 *     → key by metricName            → key by metricName
 *              \                    /
 *            AdaptiveThresholdFunction
 *              /                    \
 *   ThresholdAlert → JSON        ThresholdAdjustment → JSON
 *   → Kafka (alerts topic)       → Kafka (adjustments topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Deployment settings come from environment variables via {@link JobConfig};
 * engine tuning from the YAML loaded by {@link EngineConfigLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps each metric's windows, threshold history
 * and open batch across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class AdaptiveSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(AdaptiveSentinelJob.class);

        private AdaptiveSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Adaptive Sentinel with config: {}", config);

                EngineConfig engineConfig = loadEngineConfig(config);

                // 2. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 3. Build pipeline
                buildPipeline(env, config, engineConfig);

                // 4. Execute
                env.execute("Adaptive Sentinel – Adaptive Thresholds");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        EngineConfig engineConfig) {
                DataStream<MetricPoint> points = env.fromSource(
                                kafkaSource(config, config.getMetricsTopic(), MetricPoint.class),
                                WatermarkStrategy.noWatermarks(),
                                "kafka-metrics-source")
                                .filter(Objects::nonNull); // drop deserialization failures

                DataStream<AlertFeedback> feedback = env.fromSource(
                                kafkaSource(config, config.getFeedbackTopic(), AlertFeedback.class),
                                WatermarkStrategy.noWatermarks(),
                                "kafka-feedback-source")
                                .filter(Objects::nonNull);

                SingleOutputStreamOperator<ThresholdAlert> alerts = points
                                .connect(feedback)
                                .keyBy(MetricPoint::getMetricName, AlertFeedback::getMetricName, Types.STRING)
                                .process(new AdaptiveThresholdFunction(engineConfig))
                                .name("adaptive-thresholds");

                DataStream<ThresholdAdjustment> adjustments =
                                alerts.getSideOutput(AdaptiveThresholdFunction.ADJUSTMENTS);

                alerts.sinkTo(kafkaSink(config, config.getAlertsTopic(),
                                new JsonRecordSerializer<ThresholdAlert>()))
                                .name("kafka-alerts-sink");
                adjustments.sinkTo(kafkaSink(config, config.getAdjustmentsTopic(),
                                new JsonRecordSerializer<ThresholdAdjustment>()))
                                .name("kafka-adjustments-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSource<T> kafkaSource(JobConfig config, String topic, Class<T> recordType) {
                return KafkaSource.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(topic)
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new JsonRecordDeserializer<>(recordType))
                                .build();
        }

        private static <T> KafkaSink<T> kafkaSink(JobConfig config, String topic,
                        JsonRecordSerializer<T> serializer) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.<T>builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(serializer)
                                                                .build())
                                .build();
        }

        private static EngineConfig loadEngineConfig(JobConfig config) {
                String path = config.getEngineConfigPath();
                if (path != null && !path.isBlank()) {
                        return EngineConfigLoader.fromFile(path);
                }
                return EngineConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
