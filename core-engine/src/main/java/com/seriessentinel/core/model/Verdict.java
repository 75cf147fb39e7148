package com.seriessentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Per-observation output of the detector.
 *
 * <p>
 * Combines the outcome of the rolling z-score test and the seasonal
 * forecast-deviation test for one ingested value. A verdict is derived on
 * every call and never retained by the detector.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code forecast} defaults to {@code value} when
 * not set, which is what the forecaster returns during warm-up.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "index", "value", "forecast", "zScoreAnomaly", "seasonalAnomaly", "anomaly" })
public final class Verdict {

    private final long index;
    private final double value;
    private final double forecast;
    private final boolean zScoreAnomaly;
    private final boolean seasonalAnomaly;

    private Verdict(Builder builder) {
        this.index = builder.index;
        this.value = builder.value;
        this.forecast = builder.forecast != null ? builder.forecast : builder.value;
        this.zScoreAnomaly = builder.zScoreAnomaly;
        this.seasonalAnomaly = builder.seasonalAnomaly;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Verdict} instances.
     */
    public static class Builder {
        private long index;
        private double value;
        private Double forecast;
        private boolean zScoreAnomaly;
        private boolean seasonalAnomaly;

        public Builder index(long index) {
            this.index = index;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder forecast(double forecast) {
            this.forecast = forecast;
            return this;
        }

        public Builder zScoreAnomaly(boolean zScoreAnomaly) {
            this.zScoreAnomaly = zScoreAnomaly;
            return this;
        }

        public Builder seasonalAnomaly(boolean seasonalAnomaly) {
            this.seasonalAnomaly = seasonalAnomaly;
            return this;
        }

        public Verdict build() {
            return new Verdict(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return 0-based arrival position of the observation
     */
    @JsonProperty("index")
    public long getIndex() {
        return index;
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    /**
     * @return the one-step-ahead seasonal forecast the value was compared to
     */
    @JsonProperty("forecast")
    public double getForecast() {
        return forecast;
    }

    @JsonProperty("zScoreAnomaly")
    public boolean isZScoreAnomaly() {
        return zScoreAnomaly;
    }

    @JsonProperty("seasonalAnomaly")
    public boolean isSeasonalAnomaly() {
        return seasonalAnomaly;
    }

    /**
     * @return {@code true} if either test flagged the observation
     */
    @JsonProperty("anomaly")
    public boolean isAnomaly() {
        return zScoreAnomaly || seasonalAnomaly;
    }

    /**
     * @return the observation this verdict was derived from
     */
    @JsonIgnore
    public Observation toObservation() {
        return new Observation(index, value);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Verdict that))
            return false;
        return index == that.index
                && Double.compare(value, that.value) == 0
                && Double.compare(forecast, that.forecast) == 0
                && zScoreAnomaly == that.zScoreAnomaly
                && seasonalAnomaly == that.seasonalAnomaly;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value, forecast, zScoreAnomaly, seasonalAnomaly);
    }

    @Override
    public String toString() {
        return "Verdict{" +
                "index=" + index +
                ", value=" + value +
                ", forecast=" + forecast +
                ", zScoreAnomaly=" + zScoreAnomaly +
                ", seasonalAnomaly=" + seasonalAnomaly +
                '}';
    }
}
