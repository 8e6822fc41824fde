package org.n3x.universe.formation;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeState;

import java.time.Duration;

/**
 * Starts the primary in cluster initialization mode and waits until it is Ready in its own registry.
 * <p>
 * Port open and API ready are waited for separately: the API answers long before consensus is ready.
 */
@Slf4j
public class PrimaryInitPhase extends AbstractPhase {
    private static final String READYZ_OK = "ok";

    @NonNull
    private final ServiceFlags flags;

    public PrimaryInitPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams,
                            @NonNull ServiceFlags flags) {
        super(fleet, serviceParams, formationParams);
        this.flags = flags;
    }

    @Override
    public String name() {
        return "primary-init";
    }

    @Override
    protected String execute(FormationContext context) {
        NodeSpec spec = context.primarySpec();
        Node primary = context.primaryNode();

        execOrFail(primary, ServiceCommands.writeFile(serviceParams.getServerEnvFile(), flags.primaryEnv(spec)),
                "write server env");
        execOrFail(primary, ServiceCommands.daemonReload(), "daemon reload");

        transition(primary, NodeState.SERVICE_STARTING, "cluster init");
        execOrFail(primary, ServiceCommands.start(serviceParams.getServerUnit()), "start server");

        Duration portTimeout = context.bound(formationParams.getApiPortTimeout());
        await(primary, fleet.waitForPort(primary, serviceParams.getApiPort(), portTimeout), "API port", portTimeout);
        log.info("API port {} is open on {}", serviceParams.getApiPort(), primary.getName());

        Duration readyzTimeout = context.bound(formationParams.getReadyzTimeout());
        await(primary, fleet.waitForCondition(
                primary,
                ServiceCommands.readyz(serviceParams.getKubectl()),
                result -> result.isSuccess() && result.getOutput().trim().equals(READYZ_OK),
                readyzTimeout
        ), "API readiness", readyzTimeout);
        transition(primary, NodeState.JOINED, "API ready");

        awaitRegistry(context, primary, registry -> registry.isReady(spec.getName()),
                formationParams.getPrimaryReadyTimeout(), spec.getName() + " Ready in registry");
        transition(primary, NodeState.READY, "registry reports Ready");

        return "cluster initialized on " + spec.getName();
    }
}
