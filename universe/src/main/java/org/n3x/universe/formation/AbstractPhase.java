package org.n3x.universe.formation;

import com.google.common.base.Stopwatch;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetException;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.ShellCommand;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeState;
import org.n3x.util.retry.IntervalAndSentinelRetry.PollOutcome;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Common phase plumbing: timing, exec and wait helpers that end the phase on failure.
 */
@Slf4j
public abstract class AbstractPhase implements Phase {

    @NonNull
    protected final FleetManager fleet;

    @NonNull
    protected final ServiceParams serviceParams;

    @NonNull
    protected final FormationParams formationParams;

    protected AbstractPhase(@NonNull FleetManager fleet, @NonNull ServiceParams serviceParams,
                            @NonNull FormationParams formationParams) {
        this.fleet = fleet;
        this.serviceParams = serviceParams;
        this.formationParams = formationParams;
    }

    @Override
    public final PhaseResult run(FormationContext context) {
        log.info("===== Phase: {} =====", name());
        Stopwatch stopwatch = Stopwatch.createStarted();

        try {
            String detail = execute(context);
            return PhaseResult.success(name(), detail, stopwatch.elapsed());
        } catch (PhaseFailure failure) {
            return PhaseResult.failed(name(), failure.getNodeName(), failure.getMessage(), stopwatch.elapsed());
        }
    }

    /**
     * @return a short description of what was achieved
     */
    protected abstract String execute(FormationContext context);

    /**
     * Run a command that must succeed
     */
    protected ExecResult execOrFail(Node node, ShellCommand command, String what) {
        final ExecResult result;
        try {
            result = fleet.exec(node, command);
        } catch (FleetException ex) {
            throw new PhaseFailure(node.getName(), what + ": exec channel error: " + ex.getMessage(), ex);
        }

        if (!result.isSuccess()) {
            throw new PhaseFailure(node.getName(), String.format(
                    "%s: `%s` exited with %d: %s", what, command, result.getExitCode(), result.getOutput().trim()
            ));
        }
        return result;
    }

    protected void await(Node node, PollOutcome outcome, String what, Duration timeout) {
        if (outcome != PollOutcome.SATISFIED) {
            String reason = outcome == PollOutcome.CANCELLED ? "cancelled" : "timed out after " + timeout;
            throw new PhaseFailure(node.getName(), String.format("%s on %s: %s", what, node.getName(), reason));
        }
    }

    /**
     * Poll the primary's node registry until the condition holds. Local service status is never consulted.
     *
     * @param context   formation context
     * @param subject   node the wait is about, blamed on timeout
     * @param condition checked against every registry snapshot
     * @param timeout   wait bound, further cut down by the global deadline
     * @param what      description for logs and failures
     */
    protected void awaitRegistry(FormationContext context, Node subject, Predicate<NodeRegistry> condition,
                                 Duration timeout, String what) {
        Duration bounded = context.bound(timeout);
        log.info("Waiting up to {}s: {}", bounded.getSeconds(), what);

        PollOutcome outcome = fleet.waitForCondition(
                context.primaryNode(),
                ServiceCommands.getNodes(serviceParams.getKubectl()),
                result -> result.isSuccess() && condition.test(NodeRegistry.parse(result.getOutput())),
                bounded
        );
        await(subject, outcome, what, bounded);
    }

    protected void transition(Node node, NodeState next, String reason) {
        node.getLifecycle().transition(next, reason);
    }
}
