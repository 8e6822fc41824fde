package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeState;

/**
 * Joins agents in worker mode. Agents never start before every server is Ready.
 */
public class AgentJoinPhase extends JoinPhase {

    public AgentJoinPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams,
                          ServiceFlags flags) {
        super(fleet, serviceParams, formationParams, flags);
    }

    @Override
    public String name() {
        return "agent-join";
    }

    @Override
    protected void checkPreconditions(FormationContext context) {
        super.checkPreconditions(context);

        for (NodeSpec server : context.getNodeSpecs()) {
            if (!server.isServer()) {
                continue;
            }
            Node node = context.requireNode(server.getName());
            if (node.getState() != NodeState.READY) {
                throw new PhaseFailure(server.getName(), String.format(
                        "Server %s is %s, agents start only once every server is Ready",
                        server.getName(), node.getState()
                ));
            }
        }
    }

    @Override
    protected ImmutableList<NodeSpec> joiners(FormationContext context) {
        return context.agentSpecs();
    }

    @Override
    protected String envFile() {
        return serviceParams.getAgentEnvFile();
    }

    @Override
    protected String unit() {
        return serviceParams.getAgentUnit();
    }

    @Override
    protected String env(JoinRequest request, NodeSpec primary) {
        return flags.agentJoinEnv(request);
    }
}
