package com.seriessentinel.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LineObservationSource}.
 */
class LineObservationSourceTest {

    @Test
    @DisplayName("Should skip blank lines, comments and malformed values")
    void shouldSkipNonNumericLines() throws IOException {
        LineObservationSource source = sourceOf("# header\n1.5\n\n  2 \nabc\n-3e2\n");

        assertThat(drain(source)).containsExactly(1.5, 2.0, -300.0);
        assertThat(source.getMalformedLines()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should pass NaN through for the detector to reject")
    void shouldPassNaNThrough() throws IOException {
        List<Double> values = drain(sourceOf("NaN\n"));

        assertThat(values).hasSize(1);
        assertThat(values.get(0)).isNaN();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static LineObservationSource sourceOf(String text) {
        return new LineObservationSource(new BufferedReader(new StringReader(text)), "test", true);
    }

    private static List<Double> drain(LineObservationSource source) throws IOException {
        List<Double> values = new ArrayList<>();
        OptionalDouble next;
        while ((next = source.next()).isPresent()) {
            values.add(next.getAsDouble());
        }
        source.close();
        return values;
    }
}
