package org.n3x.util.retry;

/**
 * A unit of work that may fail transiently and be run again.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface IRetryable<T> {
    /** Returns the result on success, any exception will cause a retry */
    T retryFunction() throws Exception;
}
