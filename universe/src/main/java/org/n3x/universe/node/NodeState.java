package org.n3x.universe.node;

/**
 * Formation state of a node. States are ordered: a node moves one step forward at a time,
 * except {@link #FAILED} which is reachable from any state and is terminal.
 */
public enum NodeState {
    BOOTING,
    NETWORK_CONFIGURED,
    SERVICE_STARTING,
    JOINED,
    READY,
    FAILED;

    public boolean canTransitionTo(NodeState next) {
        if (this == FAILED) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == this.ordinal() + 1;
    }

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
