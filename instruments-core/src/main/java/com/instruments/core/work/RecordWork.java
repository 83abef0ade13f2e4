package com.instruments.core.work;

import com.instruments.api.Work;
import com.instruments.core.registry.MetricsRegistry;

/**
 * Counts an operation as an event and times it as work, stopping the timer
 * when the wrapped completion fires.
 *
 * <p>Construction records one event for {@code label} and creates the work
 * entry. The timer starts with {@link #startWork()}.
 *
 * <pre>{@code
 * RecordWork<Row> record = new RecordWork<>(registry, "db.fetch", (row, error) -> respond(row, error));
 * client.fetch(key, record.startWork().callback()::complete);
 * }</pre>
 *
 * @param <T> result type of the wrapped completion
 */
public final class RecordWork<T> {

    private final Work work;
    private final Completion<T> completion;

    public RecordWork(MetricsRegistry registry, String label, Completion<T> completion) {
        if (completion == null) {
            throw new IllegalArgumentException("A completion callback is required: " + label);
        }
        this.work = registry.newWork(label);
        this.completion = completion;
        registry.recordEvent(label);
    }

    /**
     * Starts the work timer.
     *
     * @return this, for chaining
     */
    public RecordWork<T> startWork() {
        work.start();
        return this;
    }

    /**
     * @return a completion that stops the work (as an error when the error
     *         argument is non-null) and then forwards to the original completion
     */
    public Completion<T> callback() {
        return (result, error) -> {
            stopWork(error != null);
            completion.complete(result, error);
        };
    }

    /**
     * Stops the work timer manually.
     */
    public void stopWork(boolean error) {
        work.stop(error);
    }

    public Work work() {
        return work;
    }
}
