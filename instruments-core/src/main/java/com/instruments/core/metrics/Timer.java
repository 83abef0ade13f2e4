package com.instruments.core.metrics;

import com.codahale.metrics.Clock;
import com.codahale.metrics.ExponentiallyDecayingReservoir;

import java.time.Duration;

/**
 * Duration statistics for one series of operations.
 *
 * <p>Combines three views of the same samples:
 * <ul>
 *   <li>an exact running aggregate (count, min, max, mean, variance) updated
 *       with Welford's recurrence, so mean and standard deviation do not drift
 *       over long runs;</li>
 *   <li>a Dropwizard {@link ExponentiallyDecayingReservoir}, biased toward
 *       recent samples, used only for percentile estimates;</li>
 *   <li>a {@link Meter} for throughput.</li>
 * </ul>
 *
 * <p>{@link #mean()}, {@link #stdDev()}, {@link #min()}, {@link #max()} and
 * {@link #count()} are exact regardless of reservoir eviction. Durations are
 * milliseconds. Thread-safe.
 */
public final class Timer {

    private final Meter meter;
    private final ExponentiallyDecayingReservoir reservoir;

    private long count;
    private double mean;
    private double sumOfSquaredDeviations;
    private long min;
    private long max;

    public Timer(Clock clock, Duration tickInterval, int reservoirSize, double reservoirAlpha) {
        if (reservoirSize <= 0) {
            throw new IllegalArgumentException("Reservoir size must be positive: " + reservoirSize);
        }
        this.meter = new Meter(clock, tickInterval);
        this.reservoir = new ExponentiallyDecayingReservoir(reservoirSize, reservoirAlpha, clock);
    }

    /**
     * Records one duration.
     *
     * @param durationMillis elapsed milliseconds, must not be negative
     * @throws IllegalArgumentException if the duration is negative
     */
    public void update(long durationMillis) {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Duration cannot be negative: " + durationMillis);
        }

        synchronized (this) {
            count++;
            double delta = durationMillis - mean;
            mean += delta / count;
            sumOfSquaredDeviations += delta * (durationMillis - mean);
            if (count == 1) {
                min = durationMillis;
                max = durationMillis;
            } else {
                min = Math.min(min, durationMillis);
                max = Math.max(max, durationMillis);
            }
        }

        reservoir.update(durationMillis);
        meter.mark();
    }

    /**
     * Estimates percentiles from the reservoir.
     *
     * <p>The snapshot values come back sorted. For each fraction {@code f} the
     * result holds the sample at rank
     * {@code ceil(f * n) - 1}, clamped to the sample bounds. All zeros when
     * nothing has been recorded.
     *
     * @param fractions values in [0, 1], e.g. {@code 0.5, 0.99}
     * @return one estimate per fraction, in argument order
     */
    public double[] percentiles(double... fractions) {
        double[] result = new double[fractions.length];
        long[] sample = reservoir.getSnapshot().getValues();
        if (sample.length == 0) {
            return result;
        }

        for (int i = 0; i < fractions.length; i++) {
            int rank = (int) Math.ceil(fractions[i] * sample.length) - 1;
            int index = Math.max(0, Math.min(sample.length - 1, rank));
            result[i] = sample[index];
        }
        return result;
    }

    public synchronized long count() {
        return count;
    }

    public synchronized double mean() {
        return count == 0 ? 0.0 : mean;
    }

    /**
     * @return sample standard deviation (divisor n - 1), 0 below two samples
     */
    public synchronized double stdDev() {
        if (count < 2) {
            return 0.0;
        }
        return Math.sqrt(sumOfSquaredDeviations / (count - 1));
    }

    public synchronized long min() {
        return count == 0 ? 0 : min;
    }

    public synchronized long max() {
        return count == 0 ? 0 : max;
    }

    public double oneMinuteRate() {
        return meter.oneMinuteRate();
    }

    public double fiveMinuteRate() {
        return meter.fiveMinuteRate();
    }

    public double fifteenMinuteRate() {
        return meter.fifteenMinuteRate();
    }

    public double meanRate() {
        return meter.meanRate();
    }

    /**
     * @return the throughput meter; its owner schedules {@link Meter#tick()}
     */
    public Meter meter() {
        return meter;
    }

    int sampleSize() {
        return reservoir.size();
    }

    @Override
    public String toString() {
        if (count() == 0) {
            return "Timer{count=0}";
        }
        return String.format("Timer{count=%d, min=%dms, max=%dms, mean=%.2fms, stdDev=%.2fms, p99=%.1fms}",
                count(), min(), max(), mean(), stdDev(), percentiles(0.99)[0]);
    }
}
