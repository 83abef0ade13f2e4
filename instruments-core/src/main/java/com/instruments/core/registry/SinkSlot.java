package com.instruments.core.registry;

import com.instruments.api.Sink;
import com.instruments.core.sink.NullSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active sink. Swapping closes the previous sink before the new
 * one becomes visible.
 */
final class SinkSlot {

    private static final Logger logger = LoggerFactory.getLogger(SinkSlot.class);

    private volatile Sink current = NullSink.INSTANCE;

    Sink get() {
        return current;
    }

    synchronized Sink swap(Sink next) {
        Sink previous = current;
        try {
            previous.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing sink {}", previous, e);
        }
        current = next != null ? next : NullSink.INSTANCE;
        logger.debug("Active sink is now {}", current);
        return current;
    }
}
