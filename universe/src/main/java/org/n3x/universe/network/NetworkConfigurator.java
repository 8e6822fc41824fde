package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.diagnostics.DiagnosticsCollector;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetException;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.ShellCommand;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyProfile;

/**
 * Applies a topology to a node.
 * <p>
 * The automatic network manager is masked before anything else, then the host is prepared and the
 * topology strategy plan is run command by command. The first failing command stops the plan.
 */
@Slf4j
@Builder
public class NetworkConfigurator {

    @NonNull
    private final FleetManager fleet;

    @Getter
    @NonNull
    private final TopologyStrategy strategy;

    @NonNull
    private final DiagnosticsCollector diagnostics;

    /**
     * Full ordered plan of a node, including the daemon masking and host preparation
     */
    public ImmutableList<NetworkCommand> plan(NodeSpec node) {
        return plan(strategy, node);
    }

    /**
     * Same plan as {@link #plan(NodeSpec)}, built without a fleet so it can be printed before anything boots.
     */
    public static ImmutableList<NetworkCommand> plan(TopologyStrategy strategy, NodeSpec node) {
        TopologyProfile profile = strategy.profile();

        ImmutableList.Builder<NetworkCommand> plan = ImmutableList.builder();
        plan.add(NetworkCommand.of("mask network daemon", IpCommands.maskNetworkDaemon()));
        plan.add(NetworkCommand.of("stop network daemon", IpCommands.stopNetworkDaemon()));
        plan.add(NetworkCommand.of("set hostname", IpCommands.setHostname(node.getName())));

        plan.addAll(strategy.configure(node));

        if (profile.getGateway() != null) {
            plan.add(NetworkCommand.of("default route", IpCommands.replaceDefaultRoute(
                    profile.getGateway(), profile.interfaceFor(Segment.CLUSTER)
            )));
        }

        return plan.build();
    }

    /**
     * Run the plan on a node. Safe to re-run on a configured node.
     *
     * @param node target node
     * @return transcript of the run
     * @throws NetworkApplyException on the first failing command, after diagnostics were collected
     */
    public CommandTranscript apply(Node node) {
        log.info("Configure {} network on {}", strategy.kind(), node.getName());

        CommandTranscript transcript = new CommandTranscript(node.getName());

        for (NetworkCommand step : plan(node.getSpec())) {
            ShellCommand command = step.getCommand();
            try {
                if (step.guard().isPresent() && step.shouldSkip(fleet.exec(node, step.guard().get()))) {
                    log.debug("{}: skip `{}`, already done", node.getName(), step.getDescription());
                    transcript.skipped(command);
                    continue;
                }

                ExecResult result = fleet.exec(node, command);
                transcript.executed(command, result);

                if (result.isSuccess()) {
                    continue;
                }

                if (command.isTolerated()) {
                    log.warn("{}: `{}` exited with {}, ignored", node.getName(), command, result.getExitCode());
                    continue;
                }

                String message = String.format(
                        "Network setup failed on %s. Step: %s, command: `%s`, exit code: %d, output: %s",
                        node.getName(), step.getDescription(), command, result.getExitCode(),
                        result.getOutput().trim()
                );
                throw failure(node, transcript, message, null);
            } catch (FleetException ex) {
                String message = String.format(
                        "Network setup failed on %s. Step: %s, exec channel error: %s",
                        node.getName(), step.getDescription(), ex.getMessage()
                );
                throw failure(node, transcript, message, ex);
            }
        }

        log.info("Network of {} configured: {} commands", node.getName(), transcript.getEntries().size());
        return transcript;
    }

    private NetworkApplyException failure(Node node, CommandTranscript transcript, String message, Throwable cause) {
        log.error(message);
        DiagnosticsBundle bundle = diagnostics.collect(node, transcript, message);
        return new NetworkApplyException(node.getName(), message, transcript, bundle, cause);
    }
}
