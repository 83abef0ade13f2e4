package com.instruments.core.sink;

import com.instruments.api.SinkErrorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default error channel: reports each failed send as a warning.
 */
public final class LoggingSinkErrorListener implements SinkErrorListener {

    public static final LoggingSinkErrorListener INSTANCE = new LoggingSinkErrorListener();

    private static final Logger logger = LoggerFactory.getLogger(LoggingSinkErrorListener.class);

    private LoggingSinkErrorListener() {
    }

    @Override
    public void onError(String line, Throwable error) {
        logger.warn("Failed to send metric line '{}': {}", line, error.toString());
        logger.debug("Send failure detail", error);
    }
}
