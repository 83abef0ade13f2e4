package com.instruments.core.metrics;

import com.codahale.metrics.Clock;
import com.codahale.metrics.EWMA;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks how often something happens: total count, mean rate since creation,
 * and 1/5/15-minute exponentially weighted rates.
 *
 * <p>A meter does not schedule itself. Its owner must call {@link #tick()}
 * every {@link #tickInterval()} and is responsible for cancelling that
 * schedule when the meter is discarded. Until the first tick the windowed
 * rates read 0; the first tick seeds them with the instant rate.
 *
 * <p>With the default 5 second interval the three averages are identical to
 * {@link EWMA#oneMinuteEWMA()}, {@link EWMA#fiveMinuteEWMA()} and
 * {@link EWMA#fifteenMinuteEWMA()}.
 *
 * <p>All rates are events per second. Thread-safe.
 */
public final class Meter {

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final Clock clock;
    private final Duration tickInterval;
    private final long startNanos;
    private final LongAdder count = new LongAdder();

    private final EWMA m1;
    private final EWMA m5;
    private final EWMA m15;

    public Meter(Clock clock, Duration tickInterval) {
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + tickInterval);
        }
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.startNanos = clock.getTick();
        this.m1 = ewma(1, tickInterval);
        this.m5 = ewma(5, tickInterval);
        this.m15 = ewma(15, tickInterval);
    }

    // alpha = 1 - exp(-interval / window), as in com.codahale.metrics.EWMA
    private static EWMA ewma(int minutes, Duration tickInterval) {
        long intervalNanos = tickInterval.toNanos();
        double intervalSeconds = intervalNanos / 1_000_000_000.0;
        double alpha = 1 - Math.exp(-intervalSeconds / SECONDS_PER_MINUTE / minutes);
        return new EWMA(alpha, intervalNanos, TimeUnit.NANOSECONDS);
    }

    public void mark() {
        mark(1);
    }

    public void mark(long n) {
        count.add(n);
        m1.update(n);
        m5.update(n);
        m15.update(n);
    }

    /**
     * Folds the marks accumulated since the previous tick into the windowed rates.
     */
    public void tick() {
        m1.tick();
        m5.tick();
        m15.tick();
    }

    public long count() {
        return count.sum();
    }

    public double oneMinuteRate() {
        return m1.getRate(TimeUnit.SECONDS);
    }

    public double fiveMinuteRate() {
        return m5.getRate(TimeUnit.SECONDS);
    }

    public double fifteenMinuteRate() {
        return m15.getRate(TimeUnit.SECONDS);
    }

    /**
     * @return total marks divided by seconds since creation; 0 if nothing was
     *         marked or no time has elapsed
     */
    public double meanRate() {
        long total = count();
        if (total == 0) {
            return 0.0;
        }
        long elapsedNanos = clock.getTick() - startNanos;
        if (elapsedNanos <= 0) {
            return 0.0;
        }
        return total / (elapsedNanos / 1_000_000_000.0);
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    @Override
    public String toString() {
        return String.format("Meter{count=%d, m1=%.3f, m5=%.3f, m15=%.3f, mean=%.3f}",
                count(), oneMinuteRate(), fiveMinuteRate(), fifteenMinuteRate(), meanRate());
    }
}
