package com.seriessentinel.core.config;

/**
 * Mutable POJO bound by SnakeYAML from the detection YAML file.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * windowSize: 50
 * zThreshold: 3.0
 * seasonalPeriods: 10
 * </pre>
 *
 * <p>
 * Call {@link #toConfig()} to validate and freeze the values.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    private int windowSize = DetectionConfig.DEFAULT_WINDOW_SIZE;
    private double zThreshold = DetectionConfig.DEFAULT_Z_THRESHOLD;
    private int seasonalPeriods = DetectionConfig.DEFAULT_SEASONAL_PERIODS;

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getZThreshold() {
        return zThreshold;
    }

    public void setZThreshold(double zThreshold) {
        this.zThreshold = zThreshold;
    }

    public int getSeasonalPeriods() {
        return seasonalPeriods;
    }

    public void setSeasonalPeriods(int seasonalPeriods) {
        this.seasonalPeriods = seasonalPeriods;
    }

    /**
     * Validate these settings and convert them to an immutable
     * {@link DetectionConfig}.
     *
     * @return validated configuration
     * @throws IllegalStateException if any value is out of range
     */
    public DetectionConfig toConfig() {
        try {
            return new DetectionConfig.Builder()
                    .windowSize(windowSize)
                    .zThreshold(zThreshold)
                    .seasonalPeriods(seasonalPeriods)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Detection configuration validation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "windowSize=" + windowSize +
                ", zThreshold=" + zThreshold +
                ", seasonalPeriods=" + seasonalPeriods +
                '}';
    }
}
