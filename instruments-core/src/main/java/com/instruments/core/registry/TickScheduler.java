package com.instruments.core.registry;

import com.instruments.core.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Schedules {@link Meter#tick()} at the meter's interval and hands back the
 * handle. One handle per meter; cancelling it is the owner's job.
 *
 * <p>When the executor refuses the task (it was shut down, e.g. after
 * {@link MetricsRegistry#close()}), the meter is left unticked and an already
 * cancelled handle is returned, so recording still succeeds; only the
 * windowed rates stay at 0.
 */
final class TickScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TickScheduler.class);

    private final ScheduledExecutorService executor;

    TickScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    ScheduledFuture<?> schedule(Meter meter) {
        long intervalNanos = meter.tickInterval().toNanos();
        try {
            return executor.scheduleAtFixedRate(meter::tick, intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Tick executor rejected a meter schedule; windowed rates will not advance: {}",
                    e.getMessage());
            return UnscheduledTick.INSTANCE;
        }
    }

    /**
     * Handle of a tick that never ran and never will.
     */
    static final class UnscheduledTick implements ScheduledFuture<Object> {

        static final UnscheduledTick INSTANCE = new UnscheduledTick();

        private UnscheduledTick() {
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0L;
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(0L, other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            return false;
        }

        @Override
        public boolean isCancelled() {
            return true;
        }

        @Override
        public boolean isDone() {
            return true;
        }

        @Override
        public Object get() {
            throw new CancellationException("Tick was never scheduled");
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return get();
        }
    }
}
