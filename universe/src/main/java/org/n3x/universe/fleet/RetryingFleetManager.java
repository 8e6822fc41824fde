package org.n3x.universe.fleet;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.util.retry.BackoffRetry;
import org.n3x.util.retry.IntervalAndSentinelRetry.PollOutcome;
import org.n3x.util.retry.RetryExhaustedException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retries exec calls that failed in transport, a command that ran and exited nonzero is returned as is.
 */
@Slf4j
public class RetryingFleetManager implements FleetManager {

    @NonNull
    private final FleetManager delegate;

    @NonNull
    private final BackoffRetry retry;

    public RetryingFleetManager(@NonNull FleetManager delegate, @NonNull BackoffRetry retry) {
        this.delegate = delegate;
        this.retry = retry.toBuilder()
                .retryOn(ex -> ex instanceof FleetException)
                .build();
    }

    @Override
    public void setUp() {
        delegate.setUp();
    }

    @Override
    public void tearDown() {
        delegate.tearDown();
    }

    @Override
    public Node boot(NodeSpec spec) {
        return delegate.boot(spec);
    }

    @Override
    public ExecResult exec(Node node, ShellCommand command) {
        try {
            return retry.run("exec on " + node.getName(), () -> delegate.exec(node, command));
        } catch (RetryExhaustedException ex) {
            throw new FleetException(
                    String.format("Exec channel to %s failed %d times: %s", node.getName(), ex.getAttempts(), command),
                    ex.getCause()
            );
        }
    }

    @Override
    public PollOutcome waitForBoot(Node node, Duration timeout) {
        return delegate.waitForBoot(node, timeout);
    }

    @Override
    public PollOutcome waitForPort(Node node, int port, Duration timeout) {
        return delegate.waitForPort(node, port, timeout);
    }

    @Override
    public PollOutcome waitForCondition(Node node, ShellCommand probe, Predicate<ExecResult> predicate,
                                        Duration timeout) {
        return delegate.waitForCondition(node, probe, predicate, timeout);
    }

    @Override
    public void destroy(Node node) {
        delegate.destroy(node);
    }

    @Override
    public void cancel() {
        delegate.cancel();
    }
}
