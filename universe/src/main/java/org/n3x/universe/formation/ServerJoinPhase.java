package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.NodeSpec;

public class ServerJoinPhase extends JoinPhase {

    public ServerJoinPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams,
                           ServiceFlags flags) {
        super(fleet, serviceParams, formationParams, flags);
    }

    @Override
    public String name() {
        return "server-join";
    }

    @Override
    protected ImmutableList<NodeSpec> joiners(FormationContext context) {
        return context.secondaryServerSpecs();
    }

    @Override
    protected String envFile() {
        return serviceParams.getServerEnvFile();
    }

    @Override
    protected String unit() {
        return serviceParams.getServerUnit();
    }

    @Override
    protected String env(JoinRequest request, NodeSpec primary) {
        return flags.serverJoinEnv(request, primary);
    }
}
