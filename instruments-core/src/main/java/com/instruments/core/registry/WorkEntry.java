package com.instruments.core.registry;

import com.instruments.core.metrics.Counter;
import com.instruments.core.metrics.Meter;
import com.instruments.core.metrics.Timer;

import java.util.concurrent.ScheduledFuture;

/**
 * Registry state for one work label: in-flight count, duration statistics
 * and error rate, plus the tick schedules of the timer's meter and the error
 * meter.
 */
final class WorkEntry {

    final Counter active;
    final Timer timer;
    final Meter errorMeter;

    private final ScheduledFuture<?> timerTick;
    private final ScheduledFuture<?> errorTick;

    WorkEntry(Counter active, Timer timer, Meter errorMeter, TickScheduler ticks) {
        this.active = active;
        this.timer = timer;
        this.errorMeter = errorMeter;
        this.timerTick = ticks.schedule(timer.meter());
        this.errorTick = ticks.schedule(errorMeter);
    }

    void cancelTicks() {
        timerTick.cancel(false);
        errorTick.cancel(false);
    }

    ScheduledFuture<?> timerTick() {
        return timerTick;
    }

    ScheduledFuture<?> errorTick() {
        return errorTick;
    }
}
