package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;

/**
 * Topology specific part of the network setup. Implementations turn a {@link TopologyProfile}
 * into the ordered commands that bring one node's interfaces to their declared state.
 */
public interface TopologyStrategy {

    TopologyKind kind();

    TopologyProfile profile();

    /**
     * Ordered setup plan of a node
     */
    ImmutableList<NetworkCommand> configure(NodeSpec node);

    default String addressFor(String nodeName, Segment segment) {
        return profile().addressFor(nodeName, segment);
    }

    /**
     * Checks that the profile fits the strategy.
     *
     * @throws org.n3x.universe.universe.ConfigurationException if it doesn't
     */
    void validate();
}
