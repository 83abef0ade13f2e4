/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * All current metrics, grouped by category.
 *
 * <p>List order follows the registry's map iteration order and is not sorted.
 */
@JsonPropertyOrder({"work", "events", "gauges"})
public record MetricsSnapshot(
        @JsonProperty("work") List<WorkMetric> work,
        @JsonProperty("events") List<EventMetric> events,
        @JsonProperty("gauges") List<GaugeMetric> gauges
) {
    public MetricsSnapshot {
        work = List.copyOf(work);
        events = List.copyOf(events);
        gauges = List.copyOf(gauges);
    }

    /**
     * Creates a snapshot with no metrics in any category.
     */
    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(List.of(), List.of(), List.of());
    }
}
