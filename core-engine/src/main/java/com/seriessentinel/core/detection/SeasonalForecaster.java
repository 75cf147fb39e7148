package com.seriessentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One-step-ahead seasonal forecaster.
 *
 * <p>
 * Fits a {@link HoltWintersModel} to the whole history on every call and
 * returns its next-step forecast. No model state is carried between calls.
 * </p>
 *
 * <h3>Fallbacks</h3>
 * <ul>
 * <li>Fewer than {@code 2 × seasonalPeriods} values: the last value is
 * returned unchanged.</li>
 * <li>The model cannot be fitted ({@link ModelFitException}): a warning is
 * logged and the last value is returned.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SeasonalForecaster {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalForecaster.class);

    /**
     * Forecast the value following {@code history}.
     *
     * @param history         retained values, newest last; must not be empty
     * @param seasonalPeriods season length; must be at least 1
     * @return the one-step-ahead forecast, or the last value on fallback
     * @throws NullPointerException     if {@code history} is {@code null}
     * @throws IllegalArgumentException if {@code history} is empty or
     *                                  {@code seasonalPeriods} is below 1
     */
    public double forecast(List<Double> history, int seasonalPeriods) {
        Objects.requireNonNull(history, "history must not be null");
        if (history.isEmpty()) {
            throw new IllegalArgumentException("history must not be empty");
        }
        if (seasonalPeriods < 1) {
            throw new IllegalArgumentException("seasonalPeriods must be >= 1, got: " + seasonalPeriods);
        }

        double last = history.get(history.size() - 1);
        if (history.size() < 2L * seasonalPeriods) {
            LOG.trace("Seasonal warm-up: {} of {} values", history.size(), 2L * seasonalPeriods);
            return last;
        }

        double[] series = new double[history.size()];
        for (int i = 0; i < series.length; i++) {
            series[i] = history.get(i);
        }

        try {
            HoltWintersModel model = HoltWintersModel.fit(series, seasonalPeriods);
            LOG.trace("Fitted {}", model);
            return model.forecast(1);
        } catch (ModelFitException e) {
            LOG.warn("Seasonal model fit failed, falling back to last value: {}", e.getMessage());
            return last;
        }
    }
}
