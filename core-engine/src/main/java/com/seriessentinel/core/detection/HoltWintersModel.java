package com.seriessentinel.core.detection;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Additive trend, additive season exponential smoothing (Holt-Winters).
 *
 * <p>
 * Recursions for a season of length {@code m}:
 * </p>
 *
 * <pre>
 *   level    l(t) = α·(y(t) − s(t−m)) + (1 − α)·(l(t−1) + b(t−1))
 *   trend    b(t) = β·(l(t) − l(t−1)) + (1 − β)·b(t−1)
 *   season   s(t) = γ·(y(t) − l(t))   + (1 − γ)·s(t−m)
 *   forecast ŷ(t+h) = l(t) + h·b(t) + s(t+h−m)
 * </pre>
 *
 * <h3>Initialisation</h3>
 * <p>
 * The trend starts at the mean per-step change between the first two
 * seasons. The level starts at the first season's mean carried forward along
 * that trend to the season's last value, and the seasonal indices at the
 * first season's deviations from the trend line. Smoothing starts at the
 * first value of the second season.
 * </p>
 *
 * <h3>Fitting</h3>
 * <p>
 * α, β and γ are chosen in {@code [0, 1]} by minimising the sum of squared
 * one-step-ahead errors with the bound-constrained BOBYQA optimizer from
 * Commons Math. The optimum only replaces the all-zero (smoothest) parameter
 * set when it improves the error by more than floating-point noise, so exact
 * fits keep {@code α = β = γ = 0}.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class HoltWintersModel {

    private static final int DEFAULT_MAX_EVALUATIONS = 2_000;

    /** 2n + 1 interpolation points for the three smoothing parameters. */
    private static final int INTERPOLATION_POINTS = 7;
    private static final double INITIAL_TRUST_RADIUS = 0.2;
    private static final double STOPPING_TRUST_RADIUS = 1e-6;

    private static final double[] LOWER_BOUNDS = { 0, 0, 0 };
    private static final double[] UPPER_BOUNDS = { 1, 1, 1 };
    private static final double[] START = { 0.5, 0.25, 0.25 };
    private static final double[] SMOOTHEST = { 0, 0, 0 };

    /** Relative improvement below which two error sums are considered equal. */
    private static final double RELATIVE_NOISE = 1e-10;

    private final int seasonalPeriods;
    private final int observations;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double sse;
    private final double level;
    private final double trend;

    /** Latest seasonal index per phase; slot {@code t % m} holds s(t). */
    private final double[] seasonal;

    private HoltWintersModel(int seasonalPeriods, int observations, double[] params,
            double sse, SmoothingState state) {
        this.seasonalPeriods = seasonalPeriods;
        this.observations = observations;
        this.alpha = params[0];
        this.beta = params[1];
        this.gamma = params[2];
        this.sse = sse;
        this.level = state.level;
        this.trend = state.trend;
        this.seasonal = state.seasonal;
    }

    // ---------------------------------------------------------------
    // Fitting
    // ---------------------------------------------------------------

    /**
     * Fit a model to {@code series}.
     *
     * @param series          observations, oldest first; at least
     *                        {@code 2 × seasonalPeriods} values
     * @param seasonalPeriods season length; must be at least 1
     * @return the fitted model
     * @throws NullPointerException     if {@code series} is {@code null}
     * @throws IllegalArgumentException if the series is too short or
     *                                  {@code seasonalPeriods} is below 1
     * @throws ModelFitException        if the series contains a non-finite
     *                                  value, the optimizer does not converge
     *                                  or no finite fit exists
     */
    public static HoltWintersModel fit(double[] series, int seasonalPeriods) throws ModelFitException {
        return fit(series, seasonalPeriods, DEFAULT_MAX_EVALUATIONS);
    }

    static HoltWintersModel fit(double[] series, int seasonalPeriods, int maxEvaluations)
            throws ModelFitException {
        Objects.requireNonNull(series, "series must not be null");
        if (seasonalPeriods < 1) {
            throw new IllegalArgumentException("seasonalPeriods must be >= 1, got: " + seasonalPeriods);
        }
        if (series.length < 2L * seasonalPeriods) {
            throw new IllegalArgumentException("series needs at least " + (2L * seasonalPeriods)
                    + " values for seasonalPeriods=" + seasonalPeriods + ", got: " + series.length);
        }

        double energy = 0;
        for (int t = 0; t < series.length; t++) {
            if (!Double.isFinite(series[t])) {
                throw new ModelFitException("series value at " + t + " is not finite: " + series[t]);
            }
            energy += series[t] * series[t];
        }
        if (!Double.isFinite(energy)) {
            throw new ModelFitException("series magnitude overflows double precision");
        }

        Fitter fitter = new Fitter(series, seasonalPeriods, energy);
        double[] best = fitter.search(maxEvaluations);
        double bestSse = fitter.sse(best);
        if (!Double.isFinite(bestSse)) {
            throw new ModelFitException("no parameter set gives a finite error sum");
        }

        SmoothingState state = fitter.run(best);
        HoltWintersModel model = new HoltWintersModel(seasonalPeriods, series.length, best, bestSse, state);
        if (!Double.isFinite(model.forecast(1))) {
            throw new ModelFitException("fitted model produces a non-finite forecast");
        }
        return model;
    }

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    /**
     * @param steps forecast horizon; must be at least 1
     * @return point forecast {@code steps} values past the end of the fitted
     *         series
     * @throws IllegalArgumentException if {@code steps} is below 1
     */
    public double forecast(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be >= 1, got: " + steps);
        }
        int phase = (int) (((long) observations - 1 + steps) % seasonalPeriods);
        return level + steps * trend + seasonal[phase];
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }

    public double gamma() {
        return gamma;
    }

    /**
     * @return in-sample sum of squared one-step-ahead errors
     */
    public double sse() {
        return sse;
    }

    public double level() {
        return level;
    }

    public double trend() {
        return trend;
    }

    public int seasonalPeriods() {
        return seasonalPeriods;
    }

    /**
     * @return copy of the final seasonal indices, indexed by {@code t % m}
     */
    public double[] seasonalIndices() {
        return Arrays.copyOf(seasonal, seasonal.length);
    }

    @Override
    public String toString() {
        return "HoltWintersModel{" +
                "m=" + seasonalPeriods +
                ", n=" + observations +
                ", alpha=" + alpha +
                ", beta=" + beta +
                ", gamma=" + gamma +
                ", sse=" + sse +
                '}';
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class SmoothingState {
        private double level;
        private double trend;
        private final double[] seasonal;

        private SmoothingState(double level, double trend, double[] seasonal) {
            this.level = level;
            this.trend = trend;
            this.seasonal = seasonal;
        }
    }

    private static final class Fitter {

        private final double[] series;
        private final int m;
        private final double initialLevel;
        private final double initialTrend;
        private final double[] initialSeasonal;
        private final double noiseFloor;

        private Fitter(double[] series, int m, double energy) {
            this.series = series;
            this.m = m;

            double firstMean = 0;
            double secondMean = 0;
            for (int i = 0; i < m; i++) {
                firstMean += series[i];
                secondMean += series[m + i];
            }
            firstMean /= m;
            secondMean /= m;

            // The first-season mean sits at its centre, (m - 1) / 2 steps before t = m - 1
            double centre = (m - 1) / 2.0;
            this.initialTrend = (secondMean - firstMean) / m;
            this.initialLevel = firstMean + initialTrend * centre;
            this.initialSeasonal = new double[m];
            for (int i = 0; i < m; i++) {
                initialSeasonal[i] = series[i] - (firstMean + initialTrend * (i - centre));
            }
            this.noiseFloor = energy * RELATIVE_NOISE * 1e-4;
        }

        /** Returns {alpha, beta, gamma}. */
        private double[] search(int maxEvaluations) throws ModelFitException {
            PointValuePair optimum;
            try {
                optimum = new BOBYQAOptimizer(INTERPOLATION_POINTS, INITIAL_TRUST_RADIUS, STOPPING_TRUST_RADIUS)
                        .optimize(new MaxEval(maxEvaluations),
                                new ObjectiveFunction(this::objective),
                                GoalType.MINIMIZE,
                                new InitialGuess(START),
                                new SimpleBounds(LOWER_BOUNDS, UPPER_BOUNDS));
            } catch (MathIllegalStateException e) {
                throw new ModelFitException("smoothing parameter search did not converge: " + e.getMessage(), e);
            }

            double[] candidate = optimum.getPoint();
            return improves(sse(candidate), sse(SMOOTHEST)) ? candidate : SMOOTHEST.clone();
        }

        /** Keeps the optimizer inside finite arithmetic. */
        private double objective(double[] params) {
            double value = sse(params);
            return Double.isFinite(value) ? value : Double.MAX_VALUE;
        }

        private boolean improves(double candidate, double incumbent) {
            if (!Double.isFinite(candidate)) {
                return false;
            }
            if (!Double.isFinite(incumbent)) {
                return true;
            }
            return candidate < incumbent - (incumbent * RELATIVE_NOISE + noiseFloor);
        }

        private double sse(double[] params) {
            double alpha = params[0];
            double beta = params[1];
            double gamma = params[2];
            double level = initialLevel;
            double trend = initialTrend;
            double[] seasonal = initialSeasonal.clone();
            double sum = 0;

            for (int t = m; t < series.length; t++) {
                int phase = t % m;
                double y = series[t];
                double error = y - (level + trend + seasonal[phase]);
                sum += error * error;

                double previousLevel = level;
                level = alpha * (y - seasonal[phase]) + (1 - alpha) * (level + trend);
                trend = beta * (level - previousLevel) + (1 - beta) * trend;
                seasonal[phase] = gamma * (y - level) + (1 - gamma) * seasonal[phase];
            }
            return sum;
        }

        private SmoothingState run(double[] params) {
            SmoothingState state = new SmoothingState(initialLevel, initialTrend, initialSeasonal.clone());
            double alpha = params[0];
            double beta = params[1];
            double gamma = params[2];

            for (int t = m; t < series.length; t++) {
                int phase = t % m;
                double y = series[t];
                double previousLevel = state.level;
                state.level = alpha * (y - state.seasonal[phase]) + (1 - alpha) * (state.level + state.trend);
                state.trend = beta * (state.level - previousLevel) + (1 - beta) * state.trend;
                state.seasonal[phase] = gamma * (y - state.level) + (1 - gamma) * state.seasonal[phase];
            }
            return state;
        }
    }
}
