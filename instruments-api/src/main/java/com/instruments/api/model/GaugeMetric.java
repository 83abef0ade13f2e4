/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Last value set on a gauge label.
 */
@JsonPropertyOrder({"label", "value"})
public record GaugeMetric(
        @JsonProperty("label") String label,
        @JsonProperty("value") double value
) {
    public static GaugeMetric empty(String label) {
        return new GaugeMetric(label, 0.0);
    }
}
