package org.n3x.universe.node;

import org.n3x.universe.fleet.FleetManager;

/**
 * A booted VM representing a cluster node. Instances are created by a {@link FleetManager}.
 */
public interface Node {

    NodeSpec getSpec();

    /**
     * Identifier of the VM instance in the fleet (container id, domain name, ...)
     */
    String getInstanceId();

    NodeLifecycle getLifecycle();

    default String getName() {
        return getSpec().getName();
    }

    default NodeState getState() {
        return getLifecycle().getState();
    }
}
