package com.seriessentinel.runner;

import com.seriessentinel.core.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RunnerMetrics}.
 */
class RunnerMetricsTest {

    @Test
    @DisplayName("Should count verdicts by flag")
    void shouldCountVerdicts() {
        RunnerMetrics metrics = new RunnerMetrics();

        metrics.recordVerdict(verdict(0, false, false), 2_000);
        metrics.recordVerdict(verdict(1, true, false), 3_000);
        metrics.recordVerdict(verdict(2, true, true), 4_000);
        metrics.incrementRejected();

        assertThat(metrics.getObservationsProcessed()).isEqualTo(3);
        assertThat(metrics.getAnomaliesDetected()).isEqualTo(2);
        assertThat(metrics.getObservationsRejected()).isEqualTo(1);
        assertThat(metrics.snapshot())
                .containsEntry("zscore_anomalies_total", 2L)
                .containsEntry("seasonal_anomalies_total", 1L)
                .containsEntry("last_processing_latency_us", 4L);
    }

    @Test
    @DisplayName("Snapshot should list every metric in a stable order")
    void shouldExposeAllMetricNames() {
        assertThat(new RunnerMetrics().snapshot().keySet()).containsExactly(
                "observations_processed_total",
                "anomalies_detected_total",
                "zscore_anomalies_total",
                "seasonal_anomalies_total",
                "observations_rejected_total",
                "last_processing_latency_us");
    }

    private static Verdict verdict(long index, boolean zScore, boolean seasonal) {
        return Verdict.builder()
                .index(index)
                .value(1.0)
                .zScoreAnomaly(zScore)
                .seasonalAnomaly(seasonal)
                .build();
    }
}
