package org.n3x.universe.formation;

import lombok.NonNull;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.network.NetworkApplyException;
import org.n3x.universe.network.NetworkConfigurator;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeState;

/**
 * Applies the topology to every node.
 * A failed command surfaces as {@link NetworkApplyException}, diagnostics are already collected then.
 */
public class NetworkPhase extends AbstractPhase {

    @NonNull
    private final NetworkConfigurator configurator;

    public NetworkPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams,
                        @NonNull NetworkConfigurator configurator) {
        super(fleet, serviceParams, formationParams);
        this.configurator = configurator;
    }

    @Override
    public String name() {
        return "network";
    }

    @Override
    protected String execute(FormationContext context) {
        for (Node node : context.getNodes()) {
            CommandTranscript transcript;
            try {
                transcript = configurator.apply(node);
            } catch (NetworkApplyException ex) {
                context.addTranscript(ex.getTranscript());
                throw ex;
            }
            context.addTranscript(transcript);
            transition(node, NodeState.NETWORK_CONFIGURED, configurator.getStrategy().kind() + " network applied");
        }

        return String.format("%s topology applied to %d nodes",
                configurator.getStrategy().kind(), context.getNodes().size());
    }
}
