package com.seriessentinel.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SyntheticStreamSource}.
 */
class SyntheticStreamSourceTest {

    @Test
    @DisplayName("Should produce exactly the configured number of values")
    void shouldStopAfterNumPoints() {
        SyntheticStreamSource source = new SyntheticStreamSource(25, 0.0, new Random(1));

        assertThat(drain(source)).hasSize(25);
        assertThat(source.next()).isEmpty();
        assertThat(source.getInjectedAnomalies()).isZero();
    }

    @Test
    @DisplayName("The same seed should reproduce the same stream")
    void shouldBeReproducible() {
        List<Double> first = drain(new SyntheticStreamSource(100, 0.1, new Random(99)));
        List<Double> second = drain(new SyntheticStreamSource(100, 0.1, new Random(99)));

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should inject anomalies at the configured chance")
    void shouldInjectAnomalies() {
        SyntheticStreamSource source = new SyntheticStreamSource(200, 1.0, new Random(5));

        drain(source);

        assertThat(source.getInjectedAnomalies()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new SyntheticStreamSource(0, 0.1, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SyntheticStreamSource(10, -0.1, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Double> drain(SyntheticStreamSource source) {
        List<Double> values = new ArrayList<>();
        OptionalDouble next;
        while ((next = source.next()).isPresent()) {
            values.add(next.getAsDouble());
        }
        return values;
    }
}
