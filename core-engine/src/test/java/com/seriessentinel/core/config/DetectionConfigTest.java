package com.seriessentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Defaults should match the documented values")
    void shouldExposeDefaults() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.getWindowSize()).isEqualTo(50);
        assertThat(config.getZThreshold()).isEqualTo(3.0);
        assertThat(config.getSeasonalPeriods()).isEqualTo(10);
        assertThat(config.getHistoryCapacity()).isEqualTo(100);
    }

    @Test
    @DisplayName("Builder should accept the smallest legal values")
    void shouldAcceptMinimumValues() {
        DetectionConfig config = new DetectionConfig.Builder()
                .windowSize(2)
                .zThreshold(0.1)
                .seasonalPeriods(1)
                .build();

        assertThat(config.getHistoryCapacity()).isEqualTo(4);
    }

    @Test
    @DisplayName("Builder should report every invalid field at once")
    void shouldReportAllErrors() {
        DetectionConfig.Builder builder = new DetectionConfig.Builder()
                .windowSize(1)
                .zThreshold(0)
                .seasonalPeriods(0);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize")
                .hasMessageContaining("zThreshold")
                .hasMessageContaining("seasonalPeriods");
    }

    @Test
    @DisplayName("Builder should reject non-finite thresholds")
    void shouldRejectNonFiniteThreshold() {
        assertThatThrownBy(() -> new DetectionConfig.Builder().zThreshold(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionConfig.Builder()
                .zThreshold(Double.POSITIVE_INFINITY).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toBuilder should round-trip into an equal config")
    void shouldCopyThroughBuilder() {
        DetectionConfig original = new DetectionConfig.Builder()
                .windowSize(12)
                .zThreshold(2.0)
                .seasonalPeriods(3)
                .build();

        DetectionConfig copy = original.toBuilder().build();

        assertThat(copy).isEqualTo(original).hasSameHashCodeAs(original);
        assertThat(original.toBuilder().windowSize(13).build()).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Should read detector settings from environment variables")
    void shouldResolveFromEnvironment() {
        Map<String, String> env = Map.of(
                DetectionConfig.ENV_WINDOW_SIZE, "12",
                DetectionConfig.ENV_Z_THRESHOLD, " 2.5 ",
                DetectionConfig.ENV_SEASONAL_PERIODS, "6");

        DetectionConfig config = DetectionConfig.fromEnvironment(env::get);

        assertThat(config.getWindowSize()).isEqualTo(12);
        assertThat(config.getZThreshold()).isEqualTo(2.5);
        assertThat(config.getSeasonalPeriods()).isEqualTo(6);
    }

    @Test
    @DisplayName("Unset or blank environment variables should fall back to defaults")
    void shouldDefaultUnsetEnvironmentVariables() {
        Map<String, String> env = Map.of(DetectionConfig.ENV_Z_THRESHOLD, "  ");

        assertThat(DetectionConfig.fromEnvironment(env::get)).isEqualTo(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should fail fast on an unparseable environment value")
    void shouldRejectUnparseableEnvironmentValue() {
        Map<String, String> env = Map.of(DetectionConfig.ENV_WINDOW_SIZE, "fifty");

        assertThatThrownBy(() -> DetectionConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse")
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range environment values")
    void shouldRejectOutOfRangeEnvironmentValue() {
        Map<String, String> env = Map.of(DetectionConfig.ENV_SEASONAL_PERIODS, "0");

        assertThatThrownBy(() -> DetectionConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seasonalPeriods");
    }
}
