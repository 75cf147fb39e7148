package com.seriessentinel.runner;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Synthetic test stream: a fast sine on top of a slow seasonal swing plus
 * Gaussian noise, with occasional injected anomalies.
 *
 * <pre>
 *   v(t) = sin(0.1·t) + 10·sin(0.01·t) + N(0, 0.5)
 *   with probability p:  v(t) += N(15, 5)
 * </pre>
 *
 * <p>
 * The {@link Random} is injected so runs can be reproduced from a seed.
 * </p>
 */
public class SyntheticStreamSource implements ObservationSource {

    private static final double NOISE_STDDEV = 0.5;
    private static final double ANOMALY_MEAN = 15.0;
    private static final double ANOMALY_STDDEV = 5.0;

    private final int numPoints;
    private final double anomalyChance;
    private final Random random;

    private int t;
    private int injected;

    /**
     * @param numPoints     number of values to produce; must be positive
     * @param anomalyChance probability of an injected anomaly per value, in
     *                      [0, 1]
     * @param random        random source; must not be {@code null}
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public SyntheticStreamSource(int numPoints, double anomalyChance, Random random) {
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got: " + numPoints);
        }
        if (!(anomalyChance >= 0 && anomalyChance <= 1)) {
            throw new IllegalArgumentException("anomalyChance must be in [0, 1], got: " + anomalyChance);
        }
        this.numPoints = numPoints;
        this.anomalyChance = anomalyChance;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public OptionalDouble next() {
        if (t >= numPoints) {
            return OptionalDouble.empty();
        }
        double value = Math.sin(t * 0.1) + Math.sin(t * 0.01) * 10 + random.nextGaussian() * NOISE_STDDEV;
        if (random.nextDouble() < anomalyChance) {
            value += ANOMALY_MEAN + random.nextGaussian() * ANOMALY_STDDEV;
            injected++;
        }
        t++;
        return OptionalDouble.of(value);
    }

    /**
     * @return number of anomalies injected so far
     */
    public int getInjectedAnomalies() {
        return injected;
    }

    @Override
    public String describe() {
        return "synthetic(points=" + numPoints + ", anomalyChance=" + anomalyChance + ")";
    }

    @Override
    public void close() {
        // nothing to release
    }
}
