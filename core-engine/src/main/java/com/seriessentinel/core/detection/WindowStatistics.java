package com.seriessentinel.core.detection;

import java.util.List;
import java.util.Objects;

/**
 * Population statistics over a window of values.
 *
 * @since 1.0.0
 */
public final class WindowStatistics {

    private WindowStatistics() {
        // utility class: not instantiable
    }

    /**
     * @param values non-empty list of values
     * @return arithmetic mean
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(List<Double> values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v: values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * @param values non-empty list of values
     * @return population standard deviation (divides by {@code n})
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double populationStdDev(List<Double> values) {
        return populationStdDev(values, mean(values));
    }

    /**
     * @param values non-empty list of values
     * @param mean   precomputed mean of {@code values}
     * @return population standard deviation around {@code mean}
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double populationStdDev(List<Double> values, double mean) {
        requireNonEmpty(values);
        double sumSquaredDiff = 0;
        for (double v: values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }

    private static void requireNonEmpty(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
