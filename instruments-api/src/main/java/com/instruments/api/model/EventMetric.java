/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Point-in-time statistics for an event label. Rates are per second.
 */
@JsonPropertyOrder({"label", "count", "rate_1m", "rate_5m", "rate_15m", "rate_mean"})
public record EventMetric(
        @JsonProperty("label") String label,
        @JsonProperty("count") long count,
        @JsonProperty("rate_1m") double rate1m,
        @JsonProperty("rate_5m") double rate5m,
        @JsonProperty("rate_15m") double rate15m,
        @JsonProperty("rate_mean") double rateMean
) {
    public static EventMetric empty(String label) {
        return new EventMetric(label, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
