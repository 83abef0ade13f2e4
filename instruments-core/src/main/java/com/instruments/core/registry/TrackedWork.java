package com.instruments.core.registry;

import com.instruments.api.Work;

import java.util.OptionalLong;

/**
 * Work that reports to a {@link MetricsRegistry}.
 *
 * <p>Holds only its label; the active counter, timer and error meter are
 * looked up in the registry on each call, so a label released while this
 * work is in flight fails fast with
 * {@link com.instruments.api.exceptions.MetricReleasedException}.
 */
final class TrackedWork implements Work {

    private static final long UNSET = -1L;

    private final MetricsRegistry registry;
    private final String label;

    private long startTime = UNSET;
    private long stopTime = UNSET;

    TrackedWork(MetricsRegistry registry, String label) {
        this.registry = registry;
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public void start() {
        WorkEntry entry = registry.requireWorkEntry(label);
        startTime = registry.clock().getTime();
        entry.active.inc();
    }

    @Override
    public long stop(boolean error) {
        if (startTime == UNSET) {
            throw new IllegalStateException("Work '" + label + "' stopped before it was started");
        }
        WorkEntry entry = registry.requireWorkEntry(label);

        stopTime = registry.clock().getTime();
        long delta = Math.max(0, stopTime - startTime);

        entry.active.dec();
        entry.timer.update(delta);

        if (error) {
            entry.errorMeter.mark(1);
            registry.sink().incrementCounter(MetricsRegistry.errorLabel(label), 1);
        } else {
            registry.sink().incrementTimer(label, delta);
        }
        return delta;
    }

    @Override
    public OptionalLong startTime() {
        return startTime == UNSET ? OptionalLong.empty() : OptionalLong.of(startTime);
    }

    @Override
    public OptionalLong stopTime() {
        return stopTime == UNSET ? OptionalLong.empty() : OptionalLong.of(stopTime);
    }

    @Override
    public String toString() {
        return "TrackedWork{label='" + label + "', startTime=" + startTime + ", stopTime=" + stopTime + '}';
    }
}
