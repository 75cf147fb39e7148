/**
 * Streaming anomaly detection engine.
 *
 * <p>
 * {@link com.seriessentinel.core.detection.StreamAnomalyDetector} is the
 * entry point. It combines:
 * </p>
 * <ul>
 * <li>{@link com.seriessentinel.core.detection.RollingZScoreDetector}:
 * rolling mean ± N × σ</li>
 * <li>{@link com.seriessentinel.core.detection.SeasonalForecaster}:
 * additive Holt-Winters forecast via
 * {@link com.seriessentinel.core.detection.HoltWintersModel}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.detection;
