package com.instruments.core.sink;

import com.instruments.api.Sink;
import com.instruments.api.SinkErrorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget StatsD client over UDP.
 *
 * <p>Each call is formatted as one {@link StatsdLine} and sent as one datagram.
 * Sends run on a dedicated daemon thread, so the instrumented caller never
 * waits on the network. There is no acknowledgment and no retry: a datagram
 * the network drops is lost.
 *
 * <p><b>Error reporting:</b> a failed send completes the returned future
 * exceptionally and is passed to the {@link SinkErrorListener}. Nothing is
 * thrown back to the caller.
 *
 * <p><b>Closing:</b> {@link #close()} stops accepting updates, lets already
 * queued datagrams go out, then closes the socket.
 *
 * <pre>{@code
 * try (StatsdSink sink = new StatsdSink("localhost", 8125)) {
 *     sink.incrementTimer("db.query", 42);   // "db.query:42|ms"
 *     sink.incrementCounter("db.error");     // "db.error:1|c"
 *     sink.setGauge("pool.size", 8);         // "pool.size:8|g"
 * }
 * }</pre>
 *
 * @since 2.0.0
 */
public final class StatsdSink implements Sink {

    private static final Logger logger = LoggerFactory.getLogger(StatsdSink.class);

    private final InetSocketAddress target;
    private final DatagramChannel channel;
    private final ExecutorService sender;
    private final SinkErrorListener errorListener;

    private volatile boolean closed = false;

    public StatsdSink(String host, int port) {
        this(host, port, LoggingSinkErrorListener.INSTANCE);
    }

    /**
     * Opens an unbound UDP socket targeting {@code host:port}.
     *
     * @throws UncheckedIOException if the socket cannot be opened
     */
    public StatsdSink(String host, int port, SinkErrorListener errorListener) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host cannot be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535: " + port);
        }
        this.target = new InetSocketAddress(host, port);
        this.errorListener = errorListener != null ? errorListener : LoggingSinkErrorListener.INSTANCE;
        try {
            this.channel = DatagramChannel.open();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open UDP socket for " + host + ":" + port, e);
        }
        this.sender = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "Statsd-Sender-" + host + ":" + port);
            t.setDaemon(true);
            return t;
        });
        logger.info("StatsD forwarding enabled to {}:{}", host, port);
    }

    @Override
    public CompletableFuture<Void> incrementCounter(String label, long count) {
        return send(StatsdLine.counter(label, count));
    }

    @Override
    public CompletableFuture<Void> incrementTimer(String label, long millis) {
        return send(StatsdLine.timer(label, millis));
    }

    @Override
    public CompletableFuture<Void> setGauge(String label, double value) {
        return send(StatsdLine.gauge(label, value));
    }

    private CompletableFuture<Void> send(String line) {
        if (closed) {
            return fail(line, new IllegalStateException("StatsD sink to " + target + " is closed"));
        }

        CompletableFuture<Void> result;
        try {
            result = CompletableFuture.runAsync(() -> write(line), sender);
        } catch (RejectedExecutionException e) {
            return fail(line, e);
        }

        result.whenComplete((ignored, error) -> {
            if (error != null) {
                errorListener.onError(line, unwrap(error));
            }
        });
        return result;
    }

    private void write(String line) {
        ByteBuffer datagram = StandardCharsets.UTF_8.encode(line);
        try {
            channel.send(datagram, target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private CompletableFuture<Void> fail(String line, Throwable error) {
        errorListener.onError(line, error);
        return CompletableFuture.failedFuture(error);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            sender.execute(this::closeChannel);
        } catch (RejectedExecutionException e) {
            closeChannel();
        }
        sender.shutdown();
        logger.info("StatsD forwarding to {} closed", target);
    }

    private void closeChannel() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing StatsD socket for {}", target, e);
        }
    }

    public InetSocketAddress target() {
        return target;
    }

    public boolean isClosed() {
        return closed;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof UncheckedIOException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public String toString() {
        return "StatsdSink{target=" + target + ", closed=" + closed + '}';
    }
}
