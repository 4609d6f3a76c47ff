package com.adaptivesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfig} validation.
 */
class EngineConfigTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        EngineConfig config = new EngineConfig();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.shortWindow()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.longWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(config.batchTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.checkInterval()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Should require the short window to be shorter than the long one")
    void shouldRejectInvertedWindows() {
        EngineConfig config = new EngineConfig();
        config.setShortWindowSeconds(86400);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be shorter than");
    }

    @Test
    @DisplayName("Should require feedback factors on the right side of 1")
    void shouldRejectInvertedFactors() {
        EngineConfig config = new EngineConfig();
        config.setDesensitizeFactor(0.9);
        config.setSensitizeFactor(1.1);

        assertThatThrownBy(config::validate)
                .hasMessageContaining("desensitizeFactor")
                .hasMessageContaining("sensitizeFactor");
    }

    @Test
    @DisplayName("Should require ordered false-positive bounds")
    void shouldRejectCrossedFalsePositiveBounds() {
        EngineConfig config = new EngineConfig();
        config.setFalsePositiveLow(0.5);
        config.setFalsePositiveHigh(0.1);

        assertThatThrownBy(config::validate)
                .hasMessageContaining("falsePositiveLow <= falsePositiveHigh");
    }
}
