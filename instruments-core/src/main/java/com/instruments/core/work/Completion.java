package com.instruments.core.work;

/**
 * Completion signal of an asynchronous operation.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface Completion<T> {

    /**
     * @param result operation result, null on failure
     * @param error  failure, null on success
     */
    void complete(T result, Throwable error);
}
