package com.seriessentinel.core.detection;

import com.seriessentinel.core.window.WindowBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Rolling z-score test.
 *
 * <p>
 * Measures how many population standard deviations the newest value lies
 * from the mean of the {@code windowSize} values that precede it, and flags
 * it when that distance exceeds {@code zThreshold}. The newest value is kept
 * out of its own reference window so that a single spike cannot inflate the
 * spread it is measured against.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The test only engages once the buffer holds more than {@code windowSize}
 * values. Before that it returns {@code false}.
 * </p>
 *
 * <h3>Degenerate window</h3>
 * <p>
 * A reference window with zero spread has no finite z-score. A value equal
 * to the constant window is not anomalous; any other value is. No division
 * by zero is performed.
 * </p>
 *
 * <p>
 * Instances hold no state between calls.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingZScoreDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RollingZScoreDetector.class);

    /**
     * Test the newest value in {@code buffer}.
     *
     * @param buffer     history, newest last; must not be empty
     * @param windowSize length of the reference window; must be at least 2
     * @param zThreshold outlier threshold in standard deviations; must be
     *                   positive
     * @return {@code true} if the newest value is an outlier
     * @throws NullPointerException     if {@code buffer} is {@code null}
     * @throws IllegalArgumentException if {@code buffer} is empty or a
     *                                  parameter is out of range
     */
    public boolean test(WindowBuffer buffer, int windowSize, double zThreshold) {
        Objects.requireNonNull(buffer, "WindowBuffer must not be null");
        if (buffer.isEmpty()) {
            throw new IllegalArgumentException("WindowBuffer must not be empty");
        }
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
        if (!(zThreshold > 0)) {
            throw new IllegalArgumentException("zThreshold must be > 0, got: " + zThreshold);
        }

        if (buffer.size() <= windowSize) {
            LOG.trace("z-score warm-up: {} of {} reference values", buffer.size() - 1, windowSize);
            return false;
        }

        List<Double> recent = buffer.tail(windowSize + 1);
        List<Double> reference = recent.subList(0, windowSize);
        double latest = recent.get(windowSize);

        double mean = WindowStatistics.mean(reference);
        double stddev = WindowStatistics.populationStdDev(reference, mean);
        double deviation = Math.abs(latest - mean);

        if (stddev == 0) {
            boolean fired = deviation > 0;
            if (fired) {
                LOG.debug("z-score fired on flat window: value={} level={}", latest, mean);
            }
            return fired;
        }

        double z = deviation / stddev;
        if (z > zThreshold) {
            LOG.debug("z-score fired: value={} mean={} stddev={} z={}", latest, mean, stddev, z);
            return true;
        }
        return false;
    }
}
