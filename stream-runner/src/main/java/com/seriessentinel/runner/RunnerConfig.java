package com.seriessentinel.runner;

import java.util.Objects;

/**
 * Typed, immutable configuration for the {@link SeriesSentinelRunner}.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the runner can be configured from a shell, a container {@code -e} flag or a
 * deployment manifest.
 * </p>
 *
 * <h3>Input</h3>
 * <ul>
 * <li>blank {@code INPUT_PATH}: built-in synthetic stream</li>
 * <li>{@code -}: standard input</li>
 * <li>anything else: a file with one value per line</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RunnerConfig {

    /** Input path meaning "read standard input". */
    public static final String STDIN = "-";

    private final String inputPath;
    private final int simulatorPoints;
    private final double simulatorAnomalyChance;
    private final long simulatorSeed;
    private final boolean anomaliesOnly;
    private final int healthPort;

    private RunnerConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.simulatorPoints = b.simulatorPoints;
        this.simulatorAnomalyChance = b.simulatorAnomalyChance;
        this.simulatorSeed = b.simulatorSeed;
        this.anomaliesOnly = b.anomaliesOnly;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link RunnerConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static RunnerConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputPath(env("INPUT_PATH", ""))
                    .simulatorPoints(Integer.parseInt(env("SIMULATOR_POINTS", "500")))
                    .simulatorAnomalyChance(Double.parseDouble(env("SIMULATOR_ANOMALY_CHANCE", "0.02")))
                    .simulatorSeed(Long.parseLong(env("SIMULATOR_SEED", "42")))
                    .anomaliesOnly(Boolean.parseBoolean(env("OUTPUT_ANOMALIES_ONLY", "false")))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "0")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public boolean usesSimulator() {
        return inputPath.isBlank();
    }

    public boolean usesStdin() {
        return STDIN.equals(inputPath);
    }

    public int getSimulatorPoints() {
        return simulatorPoints;
    }

    public double getSimulatorAnomalyChance() {
        return simulatorAnomalyChance;
    }

    public long getSimulatorSeed() {
        return simulatorSeed;
    }

    /**
     * @return {@code true} if only anomalous verdicts are written out
     */
    public boolean isAnomaliesOnly() {
        return anomaliesOnly;
    }

    /**
     * @return health server port, or {@code 0} when the server is disabled
     */
    public int getHealthPort() {
        return healthPort;
    }

    public boolean isHealthServerEnabled() {
        return healthPort > 0;
    }

    /**
     * @param path replacement input path; must not be {@code null}
     * @return a copy of this configuration reading from {@code path}
     */
    public RunnerConfig withInputPath(String path) {
        return new Builder()
                .inputPath(path)
                .simulatorPoints(simulatorPoints)
                .simulatorAnomalyChance(simulatorAnomalyChance)
                .simulatorSeed(simulatorSeed)
                .anomaliesOnly(anomaliesOnly)
                .healthPort(healthPort)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RunnerConfig}.
     *
     * <p>
     * The {@link #build()} method validates that simulator points are
     * positive, the anomaly chance lies in [0, 1] and the health port is
     * either 0 (disabled) or in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String inputPath = "";
        private int simulatorPoints = 500;
        private double simulatorAnomalyChance = 0.02;
        private long simulatorSeed = 42L;
        private boolean anomaliesOnly;
        private int healthPort;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder simulatorPoints(int v) {
            this.simulatorPoints = v;
            return this;
        }

        public Builder simulatorAnomalyChance(double v) {
            this.simulatorAnomalyChance = v;
            return this;
        }

        public Builder simulatorSeed(long v) {
            this.simulatorSeed = v;
            return this;
        }

        public Builder anomaliesOnly(boolean v) {
            this.anomaliesOnly = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link RunnerConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public RunnerConfig build() {
            Objects.requireNonNull(inputPath, "inputPath required");
            if (simulatorPoints < 1) {
                throw new IllegalArgumentException(
                        "simulatorPoints must be >= 1, got: " + simulatorPoints);
            }
            if (!(simulatorAnomalyChance >= 0 && simulatorAnomalyChance <= 1)) {
                throw new IllegalArgumentException(
                        "simulatorAnomalyChance must be in [0, 1], got: " + simulatorAnomalyChance);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be 0 or in [1, 65535], got: " + healthPort);
            }
            return new RunnerConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim(): defaultValue;
    }

    @Override
    public String toString() {
        return "RunnerConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", simulatorPoints=" + simulatorPoints +
                ", simulatorAnomalyChance=" + simulatorAnomalyChance +
                ", simulatorSeed=" + simulatorSeed +
                ", anomaliesOnly=" + anomaliesOnly +
                ", healthPort=" + healthPort +
                '}';
    }
}
