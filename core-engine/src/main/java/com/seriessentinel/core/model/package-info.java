/**
 * Domain model classes for Series Sentinel.
 *
 * <ul>
 * <li>{@link com.seriessentinel.core.model.Observation}: one recorded
 * value with its arrival index</li>
 * <li>{@link com.seriessentinel.core.model.Verdict}: per-value detection
 * outcome</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.model;
