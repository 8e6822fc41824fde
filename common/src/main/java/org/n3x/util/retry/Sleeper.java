package org.n3x.util.retry;

import java.time.Duration;

/**
 * Pauses the calling thread between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
