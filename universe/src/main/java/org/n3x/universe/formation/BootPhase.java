package org.n3x.universe.formation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Boots every VM in parallel, then waits for each one in turn
 */
@Slf4j
public class BootPhase extends AbstractPhase {

    public BootPhase(FleetManager fleet, ServiceParams serviceParams, FormationParams formationParams) {
        super(fleet, serviceParams, formationParams);
    }

    @Override
    public String name() {
        return "boot";
    }

    @Override
    protected String execute(FormationContext context) {
        int threads = Math.max(1, Math.min(formationParams.getBootParallelism(), context.getNodeSpecs().size()));
        ExecutorService executor = Executors.newFixedThreadPool(
                threads, new ThreadFactoryBuilder().setNameFormat("boot-%d").setDaemon(true).build()
        );

        Map<NodeSpec, Future<Node>> boots = new LinkedHashMap<>();
        try {
            for (NodeSpec spec : context.getNodeSpecs()) {
                boots.put(spec, executor.submit(() -> fleet.boot(spec)));
            }

            PhaseFailure failure = null;
            for (Map.Entry<NodeSpec, Future<Node>> boot : boots.entrySet()) {
                String name = boot.getKey().getName();
                try {
                    context.addNode(boot.getValue().get());
                } catch (ExecutionException e) {
                    log.error("Can't boot {}", name, e.getCause());
                    if (failure == null) {
                        failure = new PhaseFailure(name, "Can't boot " + name + ": " + e.getCause().getMessage(),
                                e.getCause());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PhaseFailure(name, "Interrupted while booting " + name, e);
                }
            }

            if (failure != null) {
                throw failure;
            }
        } finally {
            executor.shutdownNow();
        }

        for (Node node : context.getNodes()) {
            Duration timeout = context.bound(formationParams.getBootTimeout());
            await(node, fleet.waitForBoot(node, timeout), "boot", timeout);
            log.info("Node {} booted", node.getName());
        }

        return context.getNodes().size() + " VMs booted";
    }
}
