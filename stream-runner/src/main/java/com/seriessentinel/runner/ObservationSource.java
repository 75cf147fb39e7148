package com.seriessentinel.runner;

import java.io.IOException;
import java.util.OptionalDouble;

/**
 * Pull-based producer of stream values.
 *
 * <p>
 * Values are returned in arrival order. A source is not required to check
 * that values are finite; that is left to the detector.
 * </p>
 */
public interface ObservationSource extends AutoCloseable {

    /**
     * @return the next value, or empty once the stream is exhausted
     * @throws IOException if the underlying input cannot be read
     */
    OptionalDouble next() throws IOException;

    /**
     * @return short human-readable description used in logs
     */
    String describe();

    @Override
    void close() throws IOException;
}
