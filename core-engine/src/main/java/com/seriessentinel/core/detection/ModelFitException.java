package com.seriessentinel.core.detection;

/**
 * Signals that a seasonal model could not be fitted to a history, for
 * example because the history or the resulting forecast is not finite.
 *
 * @since 1.0.0
 */
public class ModelFitException extends Exception {

    private static final long serialVersionUID = 1L;

    public ModelFitException(String message) {
        super(message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
