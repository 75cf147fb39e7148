package com.seriessentinel.core.detection;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link HoltWintersModel}.
 */
class HoltWintersModelTest {

    private static final double[] SQUARE_WAVE = { 1, 1, -1, -1 };

    @Test
    @DisplayName("Should continue a perfectly periodic series")
    void shouldContinuePeriodicSeries() throws ModelFitException {
        HoltWintersModel model = HoltWintersModel.fit(repeat(SQUARE_WAVE, 4), 4);

        assertThat(model.forecast(1)).isCloseTo(1.0, within(1e-9));
        assertThat(model.forecast(2)).isCloseTo(1.0, within(1e-9));
        assertThat(model.forecast(3)).isCloseTo(-1.0, within(1e-9));
        assertThat(model.forecast(4)).isCloseTo(-1.0, within(1e-9));
        assertThat(model.sse()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Should keep the smoothest parameters when the fit is exact")
    void shouldPreferSmallestParametersOnTies() throws ModelFitException {
        HoltWintersModel model = HoltWintersModel.fit(repeat(SQUARE_WAVE, 4), 4);

        assertThat(model.alpha()).isZero();
        assertThat(model.beta()).isZero();
        assertThat(model.gamma()).isZero();
    }

    @Test
    @DisplayName("Should follow a linear trend with a seasonal pattern")
    void shouldFollowTrendAndSeason() throws ModelFitException {
        double[] series = new double[20];
        for (int t = 0; t < series.length; t++) {
            series[t] = 0.5 * t + SQUARE_WAVE[t % 4];
        }

        HoltWintersModel model = HoltWintersModel.fit(series, 4);

        assertThat(model.trend()).isCloseTo(0.5, within(1e-9));
        assertThat(model.forecast(1)).isCloseTo(0.5 * 20 + 1, within(1e-9));
        assertThat(model.forecast(3)).isCloseTo(0.5 * 22 - 1, within(1e-9));
    }

    @Test
    @DisplayName("Should forecast a noisy seasonal series close to its pattern")
    void shouldForecastNoisySeries() throws ModelFitException {
        Random random = new Random(42);
        double[] series = new double[60];
        for (int t = 0; t < series.length; t++) {
            series[t] = 5 * Math.sin(2 * Math.PI * t / 10) + random.nextGaussian() * 0.1;
        }

        HoltWintersModel model = HoltWintersModel.fit(series, 10);

        double expected = 5 * Math.sin(2 * Math.PI * 60 / 10);
        assertThat(model.forecast(1)).isCloseTo(expected, within(1.0));
        assertThat(model.alpha()).isBetween(0.0, 1.0);
        assertThat(model.beta()).isBetween(0.0, 1.0);
        assertThat(model.gamma()).isBetween(0.0, 1.0);
        assertThat(model.sse()).isFinite();
    }

    @Test
    @DisplayName("A season of one should reduce to Holt's linear trend")
    void shouldHandleSeasonOfOne() throws ModelFitException {
        HoltWintersModel model = HoltWintersModel.fit(new double[] { 2, 4, 6, 8, 10 }, 1);

        assertThat(model.forecast(1)).isCloseTo(12.0, within(1e-9));
        assertThat(model.seasonalIndices()).containsExactly(0.0);
    }

    @Test
    @DisplayName("Should fail to fit a series containing a non-finite value")
    void shouldRejectNonFiniteSeries() {
        double[] series = repeat(SQUARE_WAVE, 3);
        series[5] = Double.NaN;

        assertThatThrownBy(() -> HoltWintersModel.fit(series, 4))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("not finite");
    }

    @Test
    @DisplayName("Should fail to fit a series whose magnitude overflows")
    void shouldRejectOverflowingSeries() {
        double[] series = { 1e200, -1e200, 1e200, -1e200 };

        assertThatThrownBy(() -> HoltWintersModel.fit(series, 2))
                .isInstanceOf(ModelFitException.class);
    }

    @Test
    @DisplayName("Should fail to fit when the optimizer runs out of evaluations")
    void shouldWrapOptimizerFailure() {
        Random random = new Random(3);
        double[] series = new double[40];
        for (int t = 0; t < series.length; t++) {
            series[t] = SQUARE_WAVE[t % 4] + random.nextGaussian();
        }

        assertThatThrownBy(() -> HoltWintersModel.fit(series, 4, 3))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("did not converge")
                .hasCauseInstanceOf(TooManyEvaluationsException.class);
    }

    @Test
    @DisplayName("Should track a noisy trend with a seasonal pattern")
    void shouldTrackNoisyTrend() throws ModelFitException {
        Random random = new Random(8);
        double[] series = new double[48];
        for (int t = 0; t < series.length; t++) {
            series[t] = 0.2 * t + 3 * SQUARE_WAVE[t % 4] + random.nextGaussian() * 0.5;
        }

        HoltWintersModel model = HoltWintersModel.fit(series, 4);

        assertThat(model.forecast(1)).isCloseTo(0.2 * 48 + 3 * SQUARE_WAVE[0], within(2.0));
        assertThat(model.sse()).isFinite().isPositive();
    }

    @Test
    @DisplayName("Should reject a series shorter than two seasons")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> HoltWintersModel.fit(new double[] { 1, 2, 3 }, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 4");
        assertThatThrownBy(() -> HoltWintersModel.fit(new double[] { 1, 2 }, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a forecast horizon below one")
    void shouldRejectInvalidHorizon() throws ModelFitException {
        HoltWintersModel model = HoltWintersModel.fit(repeat(SQUARE_WAVE, 2), 4);

        assertThatThrownBy(() -> model.forecast(0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] repeat(double[] pattern, int cycles) {
        double[] series = new double[pattern.length * cycles];
        for (int i = 0; i < series.length; i++) {
            series[i] = pattern[i % pattern.length];
        }
        return series;
    }
}
