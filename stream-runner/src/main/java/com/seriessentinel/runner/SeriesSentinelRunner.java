package com.seriessentinel.runner;

import com.seriessentinel.core.config.DetectionConfig;
import com.seriessentinel.core.config.DetectionConfigLoader;
import com.seriessentinel.core.detection.InvalidObservationException;
import com.seriessentinel.core.detection.StreamAnomalyDetector;
import com.seriessentinel.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;

/**
 * Main entry point: streams observations through one
 * {@link StreamAnomalyDetector} and writes verdicts as JSON lines.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   ObservationSource (file, stdin or synthetic)
 *     → StreamAnomalyDetector.ingest(value)
 *     → Verdict → JSON line on stdout
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runner settings come from {@link RunnerConfig#fromEnvironment()}; the first
 * command-line argument, when given, overrides the input path. Detector
 * settings come from {@link DetectionConfigLoader#load()}. Logs go to stderr
 * so stdout carries only verdicts.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesSentinelRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesSentinelRunner.class);

    private final StreamAnomalyDetector detector;
    private final VerdictSerializer serializer;
    private final RunnerMetrics metrics;
    private final boolean anomaliesOnly;

    /**
     * @param detector      detector fed by this runner
     * @param serializer    verdict encoder
     * @param metrics       counters updated per observation
     * @param anomaliesOnly write only verdicts with a flag set
     */
    public SeriesSentinelRunner(StreamAnomalyDetector detector,
            VerdictSerializer serializer,
            RunnerMetrics metrics,
            boolean anomaliesOnly) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.anomaliesOnly = anomaliesOnly;
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment();
        if (args.length > 0) {
            config = config.withInputPath(args[0]);
        }
        DetectionConfig detectionConfig = DetectionConfigLoader.load();
        LOG.info("Starting Series Sentinel with {} and {}", config, detectionConfig);

        // 2. Start health server, if enabled
        RunnerMetrics metrics = new RunnerMetrics();
        HealthServer healthServer = new HealthServer(metrics);
        if (config.isHealthServerEnabled()) {
            healthServer.start(config.getHealthPort());
            Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));
        }

        // 3. Run the stream to completion
        SeriesSentinelRunner runner = new SeriesSentinelRunner(
                new StreamAnomalyDetector(detectionConfig),
                new VerdictSerializer(),
                metrics,
                config.isAnomaliesOnly());
        try (ObservationSource source = openSource(config)) {
            runner.run(source, System.out);
        } finally {
            healthServer.stop();
        }
    }

    /**
     * Drain {@code source} through the detector.
     *
     * <p>
     * Values the detector rejects as invalid are logged, counted and
     * skipped; the stream continues with the next value.
     * </p>
     *
     * @param source values in arrival order
     * @param out    destination for JSON lines; flushed, not closed
     * @return metrics after the run
     * @throws IOException if reading the source or writing output fails
     */
    public RunnerMetrics run(ObservationSource source, OutputStream out) throws IOException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(out, "out must not be null");
        LOG.info("Reading observations from {}", source.describe());

        OutputStream sink = new BufferedOutputStream(out);
        OptionalDouble next;
        while ((next = source.next()).isPresent()) {
            double value = next.getAsDouble();
            long startNanos = System.nanoTime();
            Verdict verdict;
            try {
                verdict = detector.ingest(value);
            } catch (InvalidObservationException e) {
                metrics.incrementRejected();
                LOG.warn("Rejected observation {} – skipping", e.getValue());
                continue;
            }
            metrics.recordVerdict(verdict, System.nanoTime() - startNanos);

            if (verdict.isAnomaly()) {
                LOG.info("Anomaly {}: forecast={} zScore={} seasonal={}",
                        verdict.toObservation(), verdict.getForecast(),
                        verdict.isZScoreAnomaly(), verdict.isSeasonalAnomaly());
            }
            if (!anomaliesOnly || verdict.isAnomaly()) {
                byte[] line = serializer.serialize(verdict);
                if (line.length > 0) {
                    sink.write(line);
                    sink.write('\n');
                }
            }
        }
        sink.flush();

        LOG.info("Stream finished: {}", metrics.snapshot());
        return metrics;
    }

    static ObservationSource openSource(RunnerConfig config) throws IOException {
        if (config.usesSimulator()) {
            return new SyntheticStreamSource(config.getSimulatorPoints(),
                    config.getSimulatorAnomalyChance(),
                    new Random(config.getSimulatorSeed()));
        }
        if (config.usesStdin()) {
            return LineObservationSource.fromStdin();
        }
        return LineObservationSource.fromPath(Path.of(config.getInputPath()));
    }
}
