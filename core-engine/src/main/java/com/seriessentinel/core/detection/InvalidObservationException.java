package com.seriessentinel.core.detection;

/**
 * Thrown by {@link StreamAnomalyDetector#ingest(double)} when an observation
 * is not a finite number. The detector state is left unchanged.
 *
 * @since 1.0.0
 */
public class InvalidObservationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final double value;

    public InvalidObservationException(double value) {
        super("Observation must be a finite number, got: " + value);
        this.value = value;
    }

    public InvalidObservationException(String message) {
        super(message);
        this.value = Double.NaN;
    }

    /**
     * @return the rejected value, or {@code NaN} if there was none
     */
    public double getValue() {
        return value;
    }
}
