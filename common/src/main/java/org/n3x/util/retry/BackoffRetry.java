package org.n3x.util.retry;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Retry with exponential backoff, bounded by an attempt count.
 * <p>
 * The first retry waits {@code settleDelay}, every following one multiplies the delay by
 * {@code multiplier} up to {@code maxDelay}. An optional sentinel stops the retry loop early:
 * the sentinel should be set to true while retrying is allowed, false otherwise.
 */
@Slf4j
@Builder(toBuilder = true)
public class BackoffRetry {

    @Getter
    @Default
    private final int attempts = 3;

    @Getter
    @Default
    @NonNull
    private final Duration settleDelay = Duration.ofSeconds(1);

    @Default
    private final double multiplier = 2.0;

    @Default
    @NonNull
    private final Duration maxDelay = Duration.ofSeconds(30);

    /**
     * Exceptions the retry is allowed to swallow. Anything else is rethrown immediately.
     */
    @Default
    @NonNull
    private final Predicate<Exception> retryOn = ex -> true;

    private final AtomicBoolean sentinel;

    @Default
    @NonNull
    private final Sleeper sleeper = Sleeper.THREAD_SLEEP;

    /**
     * Run the function until it succeeds or the attempts are exhausted.
     *
     * @param description used in logs and in the exhaustion message
     * @param runFunction retried function
     * @param <T>         result type
     * @return the first successful result
     * @throws RetryExhaustedException if no attempt succeeded
     */
    public <T> T run(String description, IRetryable<T> runFunction) {
        if (attempts < 1) {
            throw new IllegalArgumentException("Invalid number of attempts: " + attempts);
        }

        Duration delay = settleDelay;
        Exception lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!checkSentinel()) {
                throw new RetryExhaustedException("Retry cancelled: " + description, attempt - 1, lastError);
            }

            try {
                return runFunction.retryFunction();
            } catch (RuntimeException ex) {
                if (!retryOn.test(ex)) {
                    throw ex;
                }
                lastError = ex;
            } catch (Exception ex) {
                if (!retryOn.test(ex)) {
                    throw new RetryExhaustedException("Non retryable failure: " + description, attempt, ex);
                }
                lastError = ex;
            }

            if (attempt == attempts) {
                break;
            }

            log.warn("{} failed, attempt {}/{}, retrying in {} ms. Error: {}",
                    description, attempt, attempts, delay.toMillis(), lastError.getMessage());

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RetryExhaustedException("Retry interrupted: " + description, attempt, ie);
            }

            delay = nextDelay(delay);
        }

        throw new RetryExhaustedException(
                String.format("%s failed after %d attempts", description, attempts), attempts, lastError
        );
    }

    private Duration nextDelay(Duration current) {
        long next = (long) (current.toMillis() * multiplier);
        return next > maxDelay.toMillis() ? maxDelay : Duration.ofMillis(next);
    }

    /**
     * Return the value of the sentinel, if set.
     * If the sentinel is not set, true is returned.
     */
    private boolean checkSentinel() {
        return sentinel == null || sentinel.get();
    }
}
