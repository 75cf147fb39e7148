package com.seriessentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WindowStatistics}.
 */
class WindowStatisticsTest {

    @Test
    @DisplayName("Should compute the population standard deviation")
    void shouldComputePopulationStdDev() {
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);

        assertThat(WindowStatistics.mean(values)).isEqualTo(5.0);
        assertThat(WindowStatistics.populationStdDev(values)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("A single value should have zero spread")
    void shouldReturnZeroForSingleValue() {
        assertThat(WindowStatistics.populationStdDev(List.of(3.5))).isZero();
    }

    @Test
    @DisplayName("Should reject an empty window")
    void shouldRejectEmpty() {
        assertThatThrownBy(() -> WindowStatistics.mean(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
