package com.seriessentinel.runner;

import com.seriessentinel.core.model.Verdict;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters describing a running stream.
 *
 * <p>
 * Written by the processing thread and read by the health server, so every
 * field is atomic.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code observations_processed_total} – values that produced a
 * verdict</li>
 * <li>{@code anomalies_detected_total} – verdicts with either flag set</li>
 * <li>{@code zscore_anomalies_total} / {@code seasonal_anomalies_total} – per
 * test</li>
 * <li>{@code observations_rejected_total} – values refused as invalid</li>
 * <li>{@code last_processing_latency_us} – time spent in the last ingest</li>
 * </ul>
 */
public class RunnerMetrics {

    private final AtomicLong observationsProcessed = new AtomicLong();
    private final AtomicLong anomaliesDetected = new AtomicLong();
    private final AtomicLong zScoreAnomalies = new AtomicLong();
    private final AtomicLong seasonalAnomalies = new AtomicLong();
    private final AtomicLong observationsRejected = new AtomicLong();
    private final AtomicLong lastLatencyMicros = new AtomicLong();

    public void recordVerdict(Verdict verdict, long latencyNanos) {
        observationsProcessed.incrementAndGet();
        if (verdict.isAnomaly()) {
            anomaliesDetected.incrementAndGet();
        }
        if (verdict.isZScoreAnomaly()) {
            zScoreAnomalies.incrementAndGet();
        }
        if (verdict.isSeasonalAnomaly()) {
            seasonalAnomalies.incrementAndGet();
        }
        lastLatencyMicros.set(latencyNanos / 1_000);
    }

    public void incrementRejected() {
        observationsRejected.incrementAndGet();
    }

    public long getObservationsProcessed() {
        return observationsProcessed.get();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.get();
    }

    public long getObservationsRejected() {
        return observationsRejected.get();
    }

    /**
     * @return point-in-time copy of every counter, keyed by metric name
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        snapshot.put("observations_processed_total", observationsProcessed.get());
        snapshot.put("anomalies_detected_total", anomaliesDetected.get());
        snapshot.put("zscore_anomalies_total", zScoreAnomalies.get());
        snapshot.put("seasonal_anomalies_total", seasonalAnomalies.get());
        snapshot.put("observations_rejected_total", observationsRejected.get());
        snapshot.put("last_processing_latency_us", lastLatencyMicros.get());
        return snapshot;
    }
}
