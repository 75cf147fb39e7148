package com.seriessentinel.core.detection;

import com.seriessentinel.core.config.DetectionConfig;
import com.seriessentinel.core.model.Verdict;
import com.seriessentinel.core.window.WindowBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streaming anomaly detector for a single numeric series.
 *
 * <p>
 * Every value passed to {@link #ingest(double)} is appended to a bounded
 * {@link WindowBuffer} of {@code 2 × windowSize} values and then checked by
 * two tests:
 * </p>
 * <ul>
 * <li>{@link RollingZScoreDetector}: distance from the recent mean in
 * standard deviations</li>
 * <li>{@link SeasonalForecaster}: distance from the seasonal forecast,
 * compared to {@code zThreshold} times the standard deviation of the whole
 * retained window</li>
 * </ul>
 *
 * <p>
 * The seasonal test deliberately measures against the spread of the raw
 * window, not the model's residual error; that choice fixes how sensitive
 * the test is.
 * </p>
 *
 * <h3>Phases</h3>
 * <p>
 * The detector starts in {@link DetectorPhase#WARMING_UP} and moves to
 * {@link DetectorPhase#ACTIVE} once either test has enough history. It never
 * goes back and never terminates.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Calls to
 * {@link #ingest(double)} must be made in arrival order by a single caller.
 * Independent streams need independent instances.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StreamAnomalyDetector.class);

    private final DetectionConfig config;
    private final WindowBuffer buffer;
    private final RollingZScoreDetector zScoreDetector;
    private final SeasonalForecaster forecaster;

    private DetectorPhase phase = DetectorPhase.WARMING_UP;

    /**
     * Create a detector with {@link DetectionConfig#defaults()}.
     */
    public StreamAnomalyDetector() {
        this(DetectionConfig.defaults());
    }

    /**
     * @param config detector configuration; must not be {@code null}
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public StreamAnomalyDetector(DetectionConfig config) {
        this(config, new RollingZScoreDetector(), new SeasonalForecaster());
    }

    StreamAnomalyDetector(DetectionConfig config,
            RollingZScoreDetector zScoreDetector,
            SeasonalForecaster forecaster) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.zScoreDetector = Objects.requireNonNull(zScoreDetector, "zScoreDetector must not be null");
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster must not be null");
        this.buffer = new WindowBuffer(config.getHistoryCapacity());
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Record one observation and evaluate both tests against it.
     *
     * @param value the next value of the stream; must be finite
     * @return verdict for this value
     * @throws InvalidObservationException if {@code value} is NaN or
     *                                     infinite; the detector is left
     *                                     unchanged
     */
    public Verdict ingest(double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidObservationException(value);
        }

        long index = buffer.appendedCount();
        buffer.append(value);

        double zThreshold = config.getZThreshold();
        boolean zScoreAnomaly = zScoreDetector.test(buffer, config.getWindowSize(), zThreshold);

        List<Double> history = buffer.asSequence();
        double forecast = forecaster.forecast(history, config.getSeasonalPeriods());
        double spread = WindowStatistics.populationStdDev(history);
        boolean seasonalAnomaly = Math.abs(value - forecast) > zThreshold * spread;

        updatePhase();

        Verdict verdict = Verdict.builder()
                .index(index)
                .value(value)
                .forecast(forecast)
                .zScoreAnomaly(zScoreAnomaly)
                .seasonalAnomaly(seasonalAnomaly)
                .build();

        if (verdict.isAnomaly()) {
            LOG.debug("Anomaly at index {}: value={} forecast={} zScore={} seasonal={}",
                    index, value, forecast, zScoreAnomaly, seasonalAnomaly);
        }
        return verdict;
    }

    /**
     * Ingest every value in order.
     *
     * <p>
     * Stops at the first invalid value; verdicts for the values before it
     * have already been applied to the detector state.
     * </p>
     *
     * @param values values in arrival order; must not be {@code null}
     * @return one verdict per value, in the same order
     * @throws InvalidObservationException if a value is {@code null} or not
     *                                     finite
     */
    public List<Verdict> ingestAll(Iterable<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        List<Verdict> verdicts = new ArrayList<>();
        for (Double value: values) {
            if (value == null) {
                throw new InvalidObservationException("Observation must not be null");
            }
            verdicts.add(ingest(value));
        }
        return verdicts;
    }

    // ---------------------------------------------------------------
    // State
    // ---------------------------------------------------------------

    public DetectorPhase phase() {
        return phase;
    }

    /**
     * @return number of values currently retained
     */
    public int bufferSize() {
        return buffer.size();
    }

    /**
     * @return number of values accepted since construction
     */
    public long observedCount() {
        return buffer.appendedCount();
    }

    public DetectionConfig config() {
        return config;
    }

    private void updatePhase() {
        if (phase == DetectorPhase.ACTIVE) {
            return;
        }
        boolean zScoreReady = buffer.size() > config.getWindowSize();
        boolean seasonalReady = buffer.size() >= 2L * config.getSeasonalPeriods();
        if (zScoreReady || seasonalReady) {
            phase = DetectorPhase.ACTIVE;
            LOG.info("Detector active after {} observations ({})", buffer.appendedCount(), config);
        }
    }

    @Override
    public String toString() {
        return "StreamAnomalyDetector{phase=" + phase + ", " + buffer + ", " + config + '}';
    }
}
