package com.instruments.core.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Integer accumulator that can move in both directions.
 * Thread-safe.
 */
public final class Counter {

    private final AtomicLong count = new AtomicLong(0);

    public void inc() {
        inc(1);
    }

    public void inc(long n) {
        count.addAndGet(n);
    }

    public void dec() {
        dec(1);
    }

    public void dec(long n) {
        count.addAndGet(-n);
    }

    public long count() {
        return count.get();
    }

    @Override
    public String toString() {
        return "Counter{count=" + count.get() + '}';
    }
}
