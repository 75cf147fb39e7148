/**
 * Bounded-memory history of recent stream values.
 *
 * @since 1.0.0
 */
package com.seriessentinel.core.window;
