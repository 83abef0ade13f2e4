/*
 * Copyright (c) 2025 Instruments
 * Licensed under the Apache License, Version 2.0
 */
package com.instruments.api;

/**
 * Receives transport failures raised while forwarding metric updates.
 *
 * <p>Invoked on the sink's transport thread, never on the instrumented
 * caller's thread. Implementations must not block.
 */
@FunctionalInterface
public interface SinkErrorListener {

    /**
     * Called when an update could not be handed to the transport.
     *
     * @param line  the wire line that was being sent
     * @param error the transport failure
     */
    void onError(String line, Throwable error);
}
