package com.seriessentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable configuration for a
 * {@link com.seriessentinel.core.detection.StreamAnomalyDetector}.
 *
 * <ul>
 * <li>{@code windowSize}: length of the z-score slice; the retained
 * history holds {@code 2 × windowSize} values</li>
 * <li>{@code zThreshold}: number of standard deviations defining an
 * outlier for both tests</li>
 * <li>{@code seasonalPeriods}: assumed season length for the
 * forecaster</li>
 * </ul>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()}, {@link #fromEnvironment()} or the {@link Builder}.
 * The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_SIZE = 50;
    public static final double DEFAULT_Z_THRESHOLD = 3.0;
    public static final int DEFAULT_SEASONAL_PERIODS = 10;

    public static final String ENV_WINDOW_SIZE = "DETECTOR_WINDOW_SIZE";
    public static final String ENV_Z_THRESHOLD = "DETECTOR_Z_THRESHOLD";
    public static final String ENV_SEASONAL_PERIODS = "DETECTOR_SEASONAL_PERIODS";

    private final int windowSize;
    private final double zThreshold;
    private final int seasonalPeriods;

    private DetectionConfig(Builder b) {
        this.windowSize = b.windowSize;
        this.zThreshold = b.zThreshold;
        this.seasonalPeriods = b.seasonalPeriods;
    }

    /**
     * @return configuration with every field at its default
     */
    public static DetectionConfig defaults() {
        return new Builder().build();
    }

    /**
     * Build a {@link DetectionConfig} from environment variables, falling back
     * to the defaults for unset ones.
     *
     * @return validated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static DetectionConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static DetectionConfig fromEnvironment(Function<String, String> env) {
        try {
            return new Builder()
                    .windowSize(Integer.parseInt(
                            lookup(env, ENV_WINDOW_SIZE, String.valueOf(DEFAULT_WINDOW_SIZE))))
                    .zThreshold(Double.parseDouble(
                            lookup(env, ENV_Z_THRESHOLD, String.valueOf(DEFAULT_Z_THRESHOLD))))
                    .seasonalPeriods(Integer.parseInt(
                            lookup(env, ENV_SEASONAL_PERIODS, String.valueOf(DEFAULT_SEASONAL_PERIODS))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .windowSize(windowSize)
                .zThreshold(zThreshold)
                .seasonalPeriods(seasonalPeriods);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public double getZThreshold() {
        return zThreshold;
    }

    public int getSeasonalPeriods() {
        return seasonalPeriods;
    }

    /**
     * @return capacity of the retained history ({@code 2 × windowSize})
     */
    public int getHistoryCapacity() {
        return windowSize * 2;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     *
     * <p>
     * {@link #build()} checks {@code windowSize >= 2},
     * {@code zThreshold > 0} and finite, and {@code seasonalPeriods >= 1}.
     * All violations are reported together.
     * </p>
     */
    public static class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double zThreshold = DEFAULT_Z_THRESHOLD;
        private int seasonalPeriods = DEFAULT_SEASONAL_PERIODS;

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder zThreshold(double v) {
            this.zThreshold = v;
            return this;
        }

        public Builder seasonalPeriods(int v) {
            this.seasonalPeriods = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public DetectionConfig build() {
            List<String> errors = new ArrayList<>();
            if (windowSize < 2) {
                errors.add("windowSize must be >= 2, got: " + windowSize);
            }
            // Capacity is 2 × windowSize and must fit in an int
            if (windowSize > Integer.MAX_VALUE / 2) {
                errors.add("windowSize too large, got: " + windowSize);
            }
            if (!(zThreshold > 0) || Double.isInfinite(zThreshold)) {
                errors.add("zThreshold must be a positive finite number, got: " + zThreshold);
            }
            if (seasonalPeriods < 1) {
                errors.add("seasonalPeriods must be >= 1, got: " + seasonalPeriods);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid DetectionConfig: " + String.join("; ", errors));
            }
            return new DetectionConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String lookup(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionConfig that))
            return false;
        return windowSize == that.windowSize
                && Double.compare(zThreshold, that.zThreshold) == 0
                && seasonalPeriods == that.seasonalPeriods;
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSize, zThreshold, seasonalPeriods);
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "windowSize=" + windowSize +
                ", zThreshold=" + zThreshold +
                ", seasonalPeriods=" + seasonalPeriods +
                '}';
    }
}
