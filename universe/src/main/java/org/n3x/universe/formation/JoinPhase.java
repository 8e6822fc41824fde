package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeState;

/**
 * Joins nodes one by one: inject the token, point the node at the primary's cluster address,
 * start the service and wait for the primary's registry to report the node Ready.
 */
@Slf4j
public abstract class JoinPhase extends AbstractPhase {

    @NonNull
    protected final ServiceFlags flags;

    protected JoinPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams,
                        @NonNull ServiceFlags flags) {
        super(fleet, serviceParams, formationParams);
        this.flags = flags;
    }

    protected abstract ImmutableList<NodeSpec> joiners(FormationContext context);

    protected abstract String envFile();

    protected abstract String unit();

    protected abstract String env(JoinRequest request, NodeSpec primary);

    /**
     * Checked before anything is started
     */
    protected void checkPreconditions(FormationContext context) {
        context.requireToken();
    }

    @Override
    protected String execute(FormationContext context) {
        checkPreconditions(context);

        ImmutableList<NodeSpec> joiners = joiners(context);
        NodeSpec primary = context.primarySpec();

        for (NodeSpec spec : joiners) {
            join(context, spec, primary);
        }

        return joiners.isEmpty() ? "nothing to join" : joiners.size() + " nodes joined";
    }

    private void join(FormationContext context, NodeSpec spec, NodeSpec primary) {
        Node node = context.requireNode(spec.getName());
        JoinRequest request = JoinRequest.toPrimary(
                spec, context.requireToken(), context.getProfile(), primary, serviceParams.getApiPort()
        );
        log.info("Joining {} via {}", spec.getName(), request.getEndpoint());

        execOrFail(node, ServiceCommands.writeFile(envFile(), env(request, primary)), "write env");
        execOrFail(node, ServiceCommands.daemonReload(), "daemon reload");

        transition(node, NodeState.SERVICE_STARTING, "join " + request.getEndpoint());
        execOrFail(node, ServiceCommands.start(unit()), "start " + unit());

        Deadline joinDeadline = Deadline.after(context.bound(formationParams.getJoinTimeout()));

        awaitRegistry(context, node, registry -> registry.contains(spec.getName()),
                joinDeadline.remaining(), spec.getName() + " registered");
        transition(node, NodeState.JOINED, "registered in cluster");

        awaitRegistry(context, node, registry -> registry.isReady(spec.getName()),
                joinDeadline.remaining(), spec.getName() + " Ready in registry");
        transition(node, NodeState.READY, "registry reports Ready");
    }
}
