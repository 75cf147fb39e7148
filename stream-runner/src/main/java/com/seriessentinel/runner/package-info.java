/**
 * Process wrapper around the core detector.
 *
 * <p>
 * This package sources observations (file, stdin or a synthetic stream),
 * runs them through a single
 * {@link com.seriessentinel.core.detection.StreamAnomalyDetector} and writes
 * each verdict as a JSON line.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.seriessentinel.runner.SeriesSentinelRunner}: main entry
 * point</li>
 * <li>{@link com.seriessentinel.runner.RunnerConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.seriessentinel.runner.HealthServer}: HTTP health and
 * metrics endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seriessentinel.runner;
