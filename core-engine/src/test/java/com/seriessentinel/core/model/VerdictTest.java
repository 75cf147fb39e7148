package com.seriessentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Verdict}.
 */
class VerdictTest {

    @Test
    @DisplayName("Forecast should default to the value when not set")
    void shouldDefaultForecastToValue() {
        Verdict verdict = Verdict.builder().index(3).value(2.5).build();

        assertThat(verdict.getForecast()).isEqualTo(2.5);
        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.toObservation()).isEqualTo(new Observation(3, 2.5));
    }

    @Test
    @DisplayName("Either flag should mark the verdict as an anomaly")
    void shouldCombineFlags() {
        assertThat(Verdict.builder().zScoreAnomaly(true).build().isAnomaly()).isTrue();
        assertThat(Verdict.builder().seasonalAnomaly(true).build().isAnomaly()).isTrue();
    }
}
