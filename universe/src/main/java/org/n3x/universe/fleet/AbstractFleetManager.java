package org.n3x.universe.fleet;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.node.Node;
import org.n3x.util.retry.IntervalAndSentinelRetry;
import org.n3x.util.retry.IntervalAndSentinelRetry.PollOutcome;
import org.n3x.util.retry.Sleeper;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Polling part of a {@link FleetManager}: every wait is built on top of {@link #exec(Node, ShellCommand)}.
 */
@Slf4j
public abstract class AbstractFleetManager implements FleetManager {

    /**
     * Set to true while waits are allowed to continue
     */
    private final AtomicBoolean sentinel = new AtomicBoolean(true);

    @NonNull
    protected final Duration pollInterval;

    @NonNull
    private final Sleeper sleeper;

    protected AbstractFleetManager(@NonNull Duration pollInterval, @NonNull Sleeper sleeper) {
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    @Override
    public PollOutcome waitForBoot(Node node, Duration timeout) {
        log.info("Waiting for {} to finish booting", node.getName());
        return waitForCondition(
                node,
                ShellCommand.of("systemctl", "is-system-running"),
                result -> result.getOutput().contains("running") || result.getOutput().contains("degraded"),
                timeout
        );
    }

    @Override
    public PollOutcome waitForPort(Node node, int port, Duration timeout) {
        log.info("Waiting for port {} on {}", port, node.getName());
        return waitForCondition(
                node,
                ShellCommand.shell(String.format("ss -tln | grep -q ':%d '", port)),
                ExecResult::isSuccess,
                timeout
        );
    }

    @Override
    public PollOutcome waitForCondition(Node node, ShellCommand probe, Predicate<ExecResult> predicate,
                                        Duration timeout) {
        PollOutcome outcome = IntervalAndSentinelRetry.builder()
                .interval(pollInterval)
                .timeout(timeout)
                .sentinel(sentinel)
                .sleeper(sleeper)
                .build()
                .poll(() -> predicate.test(exec(node, probe)));

        log.debug("Wait on {} for `{}`: {}", node.getName(), probe, outcome);
        return outcome;
    }

    @Override
    public void cancel() {
        if (sentinel.compareAndSet(true, false)) {
            log.warn("Fleet waits cancelled");
        }
    }

    public boolean isCancelled() {
        return !sentinel.get();
    }
}
