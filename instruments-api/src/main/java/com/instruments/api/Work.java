/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api;

import java.util.OptionalLong;

/**
 * One in-flight timed operation, tracked by label.
 *
 * <p>Lifecycle: {@link #start()} once, then exactly one {@link #stop(boolean)}.
 * Reusing a stopped instance is undefined.
 *
 * <pre>{@code
 * Work work = registry.newWork("db.query");
 * work.start();
 * try {
 *     runQuery();
 *     work.stop();
 * } catch (RuntimeException e) {
 *     work.stop(true);
 *     throw e;
 * }
 * }</pre>
 *
 * @since 2.0.0
 */
public interface Work {

    /**
     * @return label this work reports under
     */
    String label();

    /**
     * Marks the operation as started.
     */
    void start();

    /**
     * Marks the operation as finished successfully.
     *
     * @return elapsed milliseconds between start and stop
     */
    default long stop() {
        return stop(false);
    }

    /**
     * Marks the operation as finished.
     *
     * @param error whether the operation failed
     * @return elapsed milliseconds between start and stop
     */
    long stop(boolean error);

    /**
     * @return epoch milliseconds of {@link #start()}, empty before start
     */
    OptionalLong startTime();

    /**
     * @return epoch milliseconds of {@link #stop(boolean)}, empty before stop
     */
    OptionalLong stopTime();
}
