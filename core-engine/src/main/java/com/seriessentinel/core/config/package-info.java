/**
 * Detector configuration and its YAML loading.
 *
 * <p>
 * {@link com.seriessentinel.core.config.DetectionConfigLoader} binds YAML
 * into {@link com.seriessentinel.core.config.DetectionSettings} and
 * validates it into an immutable
 * {@link com.seriessentinel.core.config.DetectionConfig}.
 * </p>
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.config;
