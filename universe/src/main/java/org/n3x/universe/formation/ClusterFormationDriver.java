package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.diagnostics.DiagnosticsCollector;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.network.NetworkApplyException;
import org.n3x.universe.network.NetworkConfigurator;
import org.n3x.universe.node.Node;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs the formation pipeline: boot, network, primary init, token retrieval, server join, agent join,
 * cluster readiness.
 * <p>
 * The first failure ends the run: diagnostics are collected for the failing node, the node is marked Failed,
 * pending waits are cancelled and the remaining phases are skipped.
 */
@Slf4j
@Builder
public class ClusterFormationDriver {

    @NonNull
    private final FleetManager fleet;

    @NonNull
    private final NetworkConfigurator configurator;

    @NonNull
    private final DiagnosticsCollector diagnostics;

    @Getter
    @Default
    @NonNull
    private final ServiceParams serviceParams = ServiceParams.defaults();

    @Getter
    @Default
    @NonNull
    private final FormationParams formationParams = FormationParams.defaults();

    public ImmutableList<Phase> phases(FormationContext context) {
        ServiceFlags flags = new ServiceFlags(context.getProfile(), serviceParams);

        return ImmutableList.of(
                new BootPhase(fleet, serviceParams, formationParams),
                new NetworkPhase(fleet, serviceParams, formationParams, configurator),
                new PrimaryInitPhase(fleet, serviceParams, formationParams, flags),
                new TokenRetrievalPhase(fleet, serviceParams, formationParams),
                new ServerJoinPhase(fleet, serviceParams, formationParams, flags),
                new AgentJoinPhase(fleet, serviceParams, formationParams, flags),
                new ClusterReadyPhase(fleet, serviceParams, formationParams)
        );
    }

    /**
     * Form the cluster.
     *
     * @param context run context, the booted nodes are registered in it even if formation fails
     * @throws NetworkApplyException      if a node's network could not be configured
     * @throws FormationTimeoutException if a node didn't reach the state a phase waits for
     */
    public void form(FormationContext context) {
        ImmutableList<Phase> phases = phases(context);

        for (int i = 0; i < phases.size(); i++) {
            Phase phase = phases.get(i);

            if (context.getDeadline().isExpired()) {
                PhaseResult expired = PhaseResult.failed(
                        phase.name(), null, "global timeout expired before the phase started",
                        Duration.ZERO
                );
                context.getTimeline().record(expired);
                skipRemaining(context, phases, i + 1);
                throw fail(context, expired);
            }

            final PhaseResult result;
            try {
                result = phase.run(context);
            } catch (NetworkApplyException ex) {
                context.getTimeline().record(PhaseResult.failed(
                        phase.name(), ex.getNodeName(), ex.getMessage(), Duration.ZERO
                ));
                context.addDiagnostics(ex.getDiagnostics());
                markFailed(context, ex.getNodeName(), ex.getMessage());
                abort(context, ex.getMessage());
                skipRemaining(context, phases, i + 1);
                throw ex;
            }

            context.getTimeline().record(result);

            if (!result.isSuccess()) {
                skipRemaining(context, phases, i + 1);
                throw fail(context, result);
            }
        }

        log.info("Cluster formed:\n{}", context.getTimeline().render());
    }

    private FormationTimeoutException fail(FormationContext context, PhaseResult result) {
        Optional<String> nodeName = result.failedNode();
        String message = String.format("Phase %s failed: %s", result.getPhase(), result.getDetail());

        // diagnostics first, before anything else changes on the node
        DiagnosticsBundle bundle = nodeName
                .map(name -> collect(context, name, message))
                .orElse(null);
        context.addDiagnostics(bundle);

        nodeName.ifPresent(name -> markFailed(context, name, message));
        abort(context, message);

        return new FormationTimeoutException(result.getPhase(), nodeName.orElse(null), message, bundle);
    }

    private DiagnosticsBundle collect(FormationContext context, String nodeName, String failure) {
        Optional<Node> node = context.node(nodeName);
        if (!node.isPresent()) {
            return diagnostics.unreachable(nodeName, failure);
        }
        return diagnostics.collect(node.get(), context.transcript(nodeName).orElse(null), failure);
    }

    private void markFailed(FormationContext context, String nodeName, String reason) {
        if (nodeName == null) {
            return;
        }
        context.node(nodeName).ifPresent(node -> node.getLifecycle().fail(reason));
    }

    private void abort(FormationContext context, String reason) {
        context.abort(reason);
        fleet.cancel();
    }

    private void skipRemaining(FormationContext context, ImmutableList<Phase> phases, int from) {
        for (int i = from; i < phases.size(); i++) {
            context.getTimeline().skipped(phases.get(i).name());
        }
    }
}
