package com.adaptivesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load overrides from classpath and keep defaults for the rest")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getShortWindowSeconds()).isEqualTo(600);
        assertThat(config.getLongWindowSeconds()).isEqualTo(7200);
        assertThat(config.getBatchSize()).isEqualTo(5);
        assertThat(config.getFeedbackBatchSize()).isEqualTo(4);
        assertThat(config.getGateThreshold()).isEqualTo(0.25);
        // not in the file
        assertThat(config.getVolatilityMultiplier()).isEqualTo(1.5);
        assertThat(config.getDesensitizeFactor()).isEqualTo(1.1);
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadBundledDefaults() {
        EngineConfig config = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getShortWindowSeconds()).isEqualTo(1800);
        assertThat(config.getLongWindowSeconds()).isEqualTo(86400);
        assertThat(config.getCheckEveryPoints()).isEqualTo(10);
        assertThat(config.getQueueCapacity()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("shortWindowSeconds")
                .hasMessageContaining("batchSize")
                .hasMessageContaining("sensitizeFactor");
    }

    @Test
    @DisplayName("Should use defaults for an empty file")
    void shouldDefaultEmptyFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.yml"), "");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getBatchSize()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("engine.yml"), "batchTimeoutMs: 250\nsubmitTimeoutMs: 20\n");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getBatchTimeoutMs()).isEqualTo(250);
        assertThat(config.getSubmitTimeoutMs()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void shouldRejectUnknownKeys(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("typo.yml"), "batchSise: 10\n");

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(RuntimeException.class);
    }
}
