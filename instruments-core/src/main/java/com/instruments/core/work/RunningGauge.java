package com.instruments.core.work;

import com.instruments.core.registry.MetricsRegistry;

/**
 * A running count published as a gauge on every change.
 *
 * <pre>{@code
 * RunningGauge connections = new RunningGauge(registry, "pool.connections", 0);
 * connections.incr();   // 1
 * connections.decr();   // 0
 * }</pre>
 */
public final class RunningGauge {

    private final MetricsRegistry registry;
    private final String label;
    private final double startingValue;

    private double count;

    public RunningGauge(MetricsRegistry registry, String label) {
        this(registry, label, 0);
    }

    public RunningGauge(MetricsRegistry registry, String label, double startingValue) {
        this.registry = registry;
        this.label = label;
        this.startingValue = startingValue;
        this.count = startingValue;
        publish();
    }

    public synchronized void incr() {
        incr(1);
    }

    public synchronized void incr(double value) {
        count += value;
        publish();
    }

    public synchronized void decr() {
        decr(1);
    }

    public synchronized void decr(double value) {
        count -= value;
        publish();
    }

    /**
     * Resets to the starting value.
     */
    public synchronized void reset() {
        reset(startingValue);
    }

    public synchronized void reset(double value) {
        count = value;
        publish();
    }

    public synchronized double value() {
        return count;
    }

    public String label() {
        return label;
    }

    private void publish() {
        registry.setGauge(label, count);
    }
}
