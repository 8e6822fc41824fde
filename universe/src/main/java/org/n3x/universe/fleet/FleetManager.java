package org.n3x.universe.fleet;

import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.util.retry.IntervalAndSentinelRetry.PollOutcome;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * VM runtime seam: boots named VM instances, runs commands on them and polls them.
 * <p>
 * All waits are bounded and return early with {@link PollOutcome#CANCELLED} once {@link #cancel()} was called.
 */
public interface FleetManager {

    /**
     * Prepare fleet wide resources (networks, ...) before the first boot
     */
    default void setUp() {
    }

    /**
     * Release fleet wide resources after the last node is destroyed
     */
    default void tearDown() {
    }

    /**
     * Boot a VM for the node. Returns as soon as the VM is created, see {@link #waitForBoot(Node, Duration)}.
     *
     * @throws FleetException if the VM can't be created
     */
    Node boot(NodeSpec spec);

    /**
     * Run a command on a node via the out-of-band exec channel.
     *
     * @return exit code and combined output
     * @throws FleetException if the command could not be run at all
     */
    ExecResult exec(Node node, ShellCommand command);

    /**
     * Wait until the node's init system finished booting
     */
    PollOutcome waitForBoot(Node node, Duration timeout);

    /**
     * Wait until something listens on a TCP port of the node
     */
    PollOutcome waitForPort(Node node, int port, Duration timeout);

    /**
     * Run the probe until its result matches the predicate
     */
    PollOutcome waitForCondition(Node node, ShellCommand probe, Predicate<ExecResult> predicate, Duration timeout);

    /**
     * Destroy the VM. Destroying an already destroyed VM is not an error.
     */
    void destroy(Node node);

    /**
     * Short-circuit every pending and future wait.
     */
    void cancel();
}
