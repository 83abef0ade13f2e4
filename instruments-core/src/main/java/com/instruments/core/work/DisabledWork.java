package com.instruments.core.work;

import com.instruments.api.Work;

import java.util.OptionalLong;

/**
 * Work with instrumentation switched off: no registry mutation, no
 * forwarding, {@link #stop(boolean)} returns 0.
 *
 * <p>Returned by {@code MetricsRegistry.newWork} when the registry is
 * configured with {@code instrumentationEnabled(false)}, so call sites keep a
 * single code path.
 */
public final class DisabledWork implements Work {

    private final String label;

    public DisabledWork(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public void start() {
    }

    @Override
    public long stop(boolean error) {
        return 0L;
    }

    @Override
    public OptionalLong startTime() {
        return OptionalLong.empty();
    }

    @Override
    public OptionalLong stopTime() {
        return OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "DisabledWork{label='" + label + "'}";
    }
}
