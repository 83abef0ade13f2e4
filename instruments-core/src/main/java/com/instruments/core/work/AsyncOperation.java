package com.instruments.core.work;

/**
 * An operation that signals its end by invoking a {@link Completion} as its
 * final step.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    void run(Completion<T> done);
}
