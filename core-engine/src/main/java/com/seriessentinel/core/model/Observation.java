package com.seriessentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single numeric value recorded from the stream.
 *
 * <p>
 * The {@code index} is the 0-based arrival position of the value. Instances
 * are immutable once recorded.
 * </p>
 *
 * @since 1.0.0
 */
public final class Observation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final double value;

    /**
     * @param index 0-based arrival position; must not be negative
     * @param value the observed value
     * @throws IllegalArgumentException if {@code index} is negative
     */
    public Observation(long index, double value) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        this.index = index;
        this.value = value;
    }

    public long getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return index == that.index && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value);
    }

    @Override
    public String toString() {
        return "Observation{index=" + index + ", value=" + value + '}';
    }
}
