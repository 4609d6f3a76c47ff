package com.adaptivesentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into an
 * engine input record ({@code MetricPoint} or {@code AlertFeedback}).
 * <p>
 * Malformed messages are logged and dropped (returns {@code null}), so a
 * single bad record does not crash the pipeline.
 * </p>
 *
 * @param <T> record type
 */
public class JsonRecordDeserializer<T> implements DeserializationSchema<T> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(JsonRecordDeserializer.class);

    private final Class<T> recordType;

    private transient ObjectMapper mapper;

    public JsonRecordDeserializer(Class<T> recordType) {
        this.recordType = Objects.requireNonNull(recordType, "recordType must not be null");
    }

    @Override
    public T deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, recordType);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize {} – skipping: {}", recordType.getSimpleName(), e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(T nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<T> getProducedType() {
        return TypeInformation.of(recordType);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
