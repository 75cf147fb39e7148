package com.seriessentinel.core.detection;

/**
 * Lifecycle phase of a {@link StreamAnomalyDetector}.
 *
 * <p>
 * Transitions only go from {@link #WARMING_UP} to {@link #ACTIVE}.
 * </p>
 */
public enum DetectorPhase {

    /** Neither test has enough history yet. */
    WARMING_UP,

    /** At least one test has enough history to produce a real result. */
    ACTIVE
}
