/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api;

import java.util.concurrent.CompletableFuture;

/**
 * Best-effort forwarder of metric updates to an external collector.
 *
 * <p>Every call hands its update to the transport and returns immediately.
 * The returned future completes once the transport has accepted (or rejected)
 * the update; callers are free to ignore it. Transport failures never surface
 * as exceptions thrown from these methods: they complete the future
 * exceptionally and are reported to a {@link SinkErrorListener}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Sink sink = registry.configureSink(8125, "statsd.internal");
 * sink.incrementCounter("api.requests")
 *     .whenComplete((ignored, error) -> {
 *         if (error != null) {
 *             // already reported to the error listener
 *         }
 *     });
 * }</pre>
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 2.0.0
 */
public interface Sink extends AutoCloseable {

    /**
     * Increments a counter by one.
     *
     * @param label counter key
     * @return completion of the hand-off to the transport
     */
    default CompletableFuture<Void> incrementCounter(String label) {
        return incrementCounter(label, 1);
    }

    /**
     * Increments a counter.
     *
     * @param label counter key
     * @param count amount to add
     * @return completion of the hand-off to the transport
     */
    CompletableFuture<Void> incrementCounter(String label, long count);

    /**
     * Records a timing sample.
     *
     * @param label  timer key
     * @param millis duration in milliseconds
     * @return completion of the hand-off to the transport
     */
    CompletableFuture<Void> incrementTimer(String label, long millis);

    /**
     * Sets a gauge.
     *
     * @param label gauge key
     * @param value new gauge value
     * @return completion of the hand-off to the transport
     */
    CompletableFuture<Void> setGauge(String label, double value);

    /**
     * Releases the transport. Further calls complete exceptionally.
     */
    @Override
    void close();
}
