package com.instruments.core.work;

import com.instruments.api.Work;
import com.instruments.core.registry.MetricsRegistry;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Wraps operations so that each invocation is timed as a {@link Work}.
 *
 * <pre>{@code
 * AsyncOperation<Row> lookup = done -> client.fetch(key, done::complete);
 * AsyncOperation<Row> timed = TimedOperations.timeAsync(registry, "db.fetch", lookup);
 * timed.run((row, error) -> respond(row, error));
 * }</pre>
 */
public final class TimedOperations {

    private TimedOperations() {
        throw new AssertionError("No instances");
    }

    /**
     * Returns an operation that starts a {@link Work} for {@code label}, runs
     * {@code operation}, and stops the work when the operation signals
     * completion. The completion is then forwarded unchanged. Nothing is
     * recorded until the returned operation is run.
     *
     * <p>Running the returned operation with a null completion fails with
     * {@link IllegalArgumentException} before anything is started. If the
     * operation throws before signalling completion, the work is stopped as
     * an error and the exception is rethrown.
     */
    public static <T> AsyncOperation<T> timeAsync(MetricsRegistry registry, String label,
                                                  AsyncOperation<T> operation) {
        if (registry == null || operation == null) {
            throw new IllegalArgumentException("Registry and operation are required");
        }
        return done -> {
            if (done == null) {
                throw new IllegalArgumentException(
                        "A completion callback is required when timing an async operation: " + label);
            }
            Work work = registry.newWork(label);
            AtomicBoolean stopped = new AtomicBoolean(false);
            work.start();
            try {
                operation.run((result, error) -> {
                    if (stopped.compareAndSet(false, true)) {
                        work.stop();
                    }
                    done.complete(result, error);
                });
            } catch (RuntimeException e) {
                if (stopped.compareAndSet(false, true)) {
                    work.stop(true);
                }
                throw e;
            }
        };
    }

    /**
     * Times the stage returned by {@code operation}. An exceptional completion
     * (or a supplier that throws) stops the work with {@code error = true}.
     */
    public static <T> CompletionStage<T> timeFuture(MetricsRegistry registry, String label,
                                                    Supplier<? extends CompletionStage<T>> operation) {
        Work work = registry.newWork(label);
        work.start();

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            work.stop(true);
            throw e;
        }
        if (stage == null) {
            work.stop(true);
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Operation '" + label + "' returned no completion stage"));
        }
        return stage.whenComplete((result, error) -> work.stop(error != null));
    }

    /**
     * Times a synchronous call. A thrown exception stops the work with
     * {@code error = true} and is rethrown.
     */
    public static <T> T time(MetricsRegistry registry, String label, Callable<T> callable) throws Exception {
        Work work = registry.newWork(label);
        work.start();
        T result;
        try {
            result = callable.call();
        } catch (Exception e) {
            work.stop(true);
            throw e;
        }
        work.stop();
        return result;
    }
}
