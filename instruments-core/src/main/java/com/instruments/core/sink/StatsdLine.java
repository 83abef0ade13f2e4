package com.instruments.core.sink;

import java.math.BigDecimal;

/**
 * StatsD wire format: {@code <label>:<value>|<unit>}.
 */
public final class StatsdLine {

    public static final String COUNTER = "c";
    public static final String TIMER = "ms";
    public static final String GAUGE = "g";

    private StatsdLine() {
        throw new AssertionError("No instances");
    }

    public static String counter(String label, long count) {
        return label + ':' + count + '|' + COUNTER;
    }

    public static String timer(String label, long millis) {
        return label + ':' + millis + '|' + TIMER;
    }

    public static String gauge(String label, double value) {
        return label + ':' + formatNumber(value) + '|' + GAUGE;
    }

    /**
     * Integral values print without a decimal point, others in plain notation
     * ({@code 0.00001}, never {@code 1.0E-5}).
     */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
