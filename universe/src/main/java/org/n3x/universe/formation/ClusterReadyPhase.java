package org.n3x.universe.formation;

import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeState;

/**
 * Every node is Ready and the registry's Ready count equals the node count, so no node went missing
 */
public class ClusterReadyPhase extends AbstractPhase {

    public ClusterReadyPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams) {
        super(fleet, serviceParams, formationParams);
    }

    @Override
    public String name() {
        return "cluster-ready";
    }

    @Override
    protected String execute(FormationContext context) {
        for (Node node : context.getNodes()) {
            if (node.getState() != NodeState.READY) {
                throw new PhaseFailure(node.getName(), node.getName() + " is " + node.getState());
            }
        }

        int expected = context.getNodeSpecs().size();
        awaitRegistry(context, context.primaryNode(),
                registry -> registry.readyCount() == expected && context.getNodeSpecs().stream()
                        .allMatch(spec -> registry.isReady(spec.getName())),
                formationParams.getClusterReadyTimeout(),
                "registry reports " + expected + " Ready nodes");

        return expected + "/" + expected + " nodes Ready";
    }
}
