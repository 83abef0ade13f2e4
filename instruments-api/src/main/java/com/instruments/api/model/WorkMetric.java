/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Point-in-time statistics for a work label.
 *
 * <p>Durations are in milliseconds, rates are per second. Every field is
 * always present; a label with no recorded activity yields {@link #empty(String)}.
 */
@JsonPropertyOrder({
        "label", "ops_count", "rate_1m", "rate_5m", "rate_15m", "mean_rate",
        "min", "max", "mean_time", "std_dev",
        "pct_1", "pct_25", "pct_50", "pct_75", "pct_99", "pct_999",
        "active", "errors", "err_rate_1m", "err_rate_5m", "err_rate_15m", "err_mean_rate"
})
public record WorkMetric(
        @JsonProperty("label") String label,
        @JsonProperty("ops_count") long opsCount,
        @JsonProperty("rate_1m") double rate1m,
        @JsonProperty("rate_5m") double rate5m,
        @JsonProperty("rate_15m") double rate15m,
        @JsonProperty("mean_rate") double meanRate,
        @JsonProperty("min") long min,
        @JsonProperty("max") long max,
        @JsonProperty("mean_time") double meanTime,
        @JsonProperty("std_dev") double stdDev,
        @JsonProperty("pct_1") double pct1,
        @JsonProperty("pct_25") double pct25,
        @JsonProperty("pct_50") double pct50,
        @JsonProperty("pct_75") double pct75,
        @JsonProperty("pct_99") double pct99,
        @JsonProperty("pct_999") double pct999,
        @JsonProperty("active") long active,
        @JsonProperty("errors") long errors,
        @JsonProperty("err_rate_1m") double errRate1m,
        @JsonProperty("err_rate_5m") double errRate5m,
        @JsonProperty("err_rate_15m") double errRate15m,
        @JsonProperty("err_mean_rate") double errMeanRate
) {
    /**
     * Creates the zero-valued snapshot for a label with no activity.
     */
    public static WorkMetric empty(String label) {
        return new WorkMetric(label, 0, 0.0, 0.0, 0.0, 0.0, 0, 0, 0.0, 0.0,
                0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
