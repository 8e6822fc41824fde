package org.n3x.util.retry;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Bounded, cancellable polling: evaluates a condition every {@code interval} until it holds,
 * the timeout expires, or the sentinel is cleared.
 * <p>
 * The sentinel should be set to true if we should continue polling, false otherwise.
 */
@Slf4j
@Builder
public class IntervalAndSentinelRetry {

    @Default
    @NonNull
    private final Duration interval = Duration.ofSeconds(5);

    @NonNull
    private final Duration timeout;

    private final AtomicBoolean sentinel;

    @Default
    @NonNull
    private final Sleeper sleeper = Sleeper.THREAD_SLEEP;

    /**
     * Poll the condition.
     *
     * @param condition evaluated on every tick, exceptions count as "not yet"
     * @return how the poll ended
     */
    public PollOutcome poll(BooleanSupplier condition) {
        final long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (!checkSentinel()) {
                return PollOutcome.CANCELLED;
            }

            try {
                if (condition.getAsBoolean()) {
                    return PollOutcome.SATISFIED;
                }
            } catch (RuntimeException ex) {
                log.debug("Poll condition failed: {}", ex.getMessage());
            }

            if (System.nanoTime() - deadline >= 0) {
                return PollOutcome.TIMED_OUT;
            }

            try {
                sleeper.sleep(interval);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return PollOutcome.CANCELLED;
            }
        }
    }

    private boolean checkSentinel() {
        return sentinel == null || sentinel.get();
    }

    /**
     * Result of a poll.
     */
    public enum PollOutcome {
        SATISFIED, TIMED_OUT, CANCELLED
    }
}
