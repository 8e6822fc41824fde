package org.n3x.universe.formation;

import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;

import java.time.Duration;

/**
 * Reads the join token from the primary through the exec channel, the data network is not used
 */
public class TokenRetrievalPhase extends AbstractPhase {

    public TokenRetrievalPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams) {
        super(fleet, serviceParams, formationParams);
    }

    @Override
    public String name() {
        return "token";
    }

    @Override
    protected String execute(FormationContext context) {
        Node primary = context.primaryNode();
        String path = serviceParams.getTokenPath();

        Duration timeout = context.bound(formationParams.getTokenTimeout());
        await(primary, fleet.waitForCondition(
                primary, ServiceCommands.fileNotEmpty(path), ExecResult::isSuccess, timeout
        ), "token file " + path, timeout);

        ExecResult result = execOrFail(primary, ServiceCommands.readFile(path), "read token");
        try {
            context.setToken(ClusterToken.of(result.getOutput()));
        } catch (IllegalArgumentException ex) {
            throw new PhaseFailure(primary.getName(), "Token file is empty: " + path, ex);
        }

        return "token retrieved from " + primary.getName();
    }
}
