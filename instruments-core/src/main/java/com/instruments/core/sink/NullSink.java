package com.instruments.core.sink;

import com.instruments.api.Sink;

import java.util.concurrent.CompletableFuture;

/**
 * Sink used when forwarding is disabled. Every call completes immediately
 * without error; {@link #close()} does nothing.
 */
public final class NullSink implements Sink {

    public static final NullSink INSTANCE = new NullSink();

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private NullSink() {
    }

    @Override
    public CompletableFuture<Void> incrementCounter(String label, long count) {
        return DONE;
    }

    @Override
    public CompletableFuture<Void> incrementTimer(String label, long millis) {
        return DONE;
    }

    @Override
    public CompletableFuture<Void> setGauge(String label, double value) {
        return DONE;
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return "NullSink";
    }
}
