package com.adaptivesentinel.flink;

import com.adaptivesentinel.core.model.AlertFeedback;
import com.adaptivesentinel.core.model.MetricPoint;
import com.adaptivesentinel.core.model.ThresholdAdjustment;
import com.adaptivesentinel.core.model.ThresholdAlert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wire-format tests for {@link JsonRecordDeserializer} and
 * {@link JsonRecordSerializer}.
 */
class JsonRecordSchemaTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("Should read a metric point with an ISO-8601 timestamp")
    void shouldReadMetricPoint() {
        JsonRecordDeserializer<MetricPoint> schema = new JsonRecordDeserializer<>(MetricPoint.class);

        MetricPoint point = schema.deserialize(bytes(
                "{\"metricName\":\"checkout-latency\",\"value\":212.5,\"timestamp\":\"2024-05-01T10:00:00Z\",\"host\":\"a1\"}"));

        assertThat(point).isEqualTo(new MetricPoint("checkout-latency", 212.5, T0));
    }

    @Test
    @DisplayName("Should read alert feedback")
    void shouldReadFeedback() {
        JsonRecordDeserializer<AlertFeedback> schema = new JsonRecordDeserializer<>(AlertFeedback.class);

        AlertFeedback feedback = schema.deserialize(bytes("{\"metricName\":\"checkout-latency\",\"wasUseful\":true}"));

        assertThat(feedback.getMetricName()).isEqualTo("checkout-latency");
        assertThat(feedback.wasUseful()).isTrue();
    }

    @Test
    @DisplayName("Should drop malformed and empty records")
    void shouldDropMalformedRecords() {
        JsonRecordDeserializer<MetricPoint> schema = new JsonRecordDeserializer<>(MetricPoint.class);

        assertThat(schema.deserialize(bytes("not json"))).isNull();
        assertThat(schema.deserialize(bytes("{\"value\":1.0}"))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.isEndOfStream(null)).isFalse();
    }

    @Test
    @DisplayName("Should write an alert with an ISO-8601 timestamp")
    void shouldWriteAlert() {
        ThresholdAlert alert = ThresholdAlert.builder()
                .metricName("checkout-latency")
                .value(400)
                .threshold(250.25)
                .timestamp(T0)
                .details("Threshold exceeded")
                .build();

        String json = new String(new JsonRecordSerializer<ThresholdAlert>().serialize(alert), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"metricName\":\"checkout-latency\"")
                .contains("\"threshold\":250.25")
                .contains("\"timestamp\":\"2024-05-01T10:00:00Z\"");
    }

    @Test
    @DisplayName("Should write an adjustment with its source")
    void shouldWriteAdjustment() {
        ThresholdAdjustment adjustment = new ThresholdAdjustment("checkout-latency", T0, 100, 110,
                "feedback-driven sensitivity change", ThresholdAdjustment.Source.FEEDBACK);

        String json = new String(new JsonRecordSerializer<ThresholdAdjustment>().serialize(adjustment),
                StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"previousThreshold\":100.0")
                .contains("\"newThreshold\":110.0")
                .contains("\"source\":\"FEEDBACK\"");
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
