package org.n3x.util.retry;

import lombok.Getter;

/**
 * Thrown when a {@link BackoffRetry} ran out of attempts or was cancelled by its sentinel.
 * The last failure is kept as the cause.
 */
public class RetryExhaustedException extends RuntimeException {

    @Getter
    private final int attempts;

    public RetryExhaustedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
