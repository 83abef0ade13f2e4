package com.instruments.core.registry;

import com.instruments.core.metrics.Meter;

import java.util.concurrent.ScheduledFuture;

/**
 * Registry state for one event label.
 */
final class EventEntry {

    final Meter meter;

    private final ScheduledFuture<?> tick;

    EventEntry(Meter meter, TickScheduler ticks) {
        this.meter = meter;
        this.tick = ticks.schedule(meter);
    }

    void cancelTicks() {
        tick.cancel(false);
    }

    ScheduledFuture<?> tick() {
        return tick;
    }
}
