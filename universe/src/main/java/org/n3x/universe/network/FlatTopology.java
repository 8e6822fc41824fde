package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.universe.ConfigurationException;

/**
 * A single untagged network: the cluster interface gets its static address.
 */
@AllArgsConstructor
public class FlatTopology implements TopologyStrategy {

    @NonNull
    private final TopologyProfile profile;

    @Override
    public TopologyKind kind() {
        return TopologyKind.FLAT;
    }

    @Override
    public TopologyProfile profile() {
        return profile;
    }

    @Override
    public ImmutableList<NetworkCommand> configure(NodeSpec node) {
        String iface = profile.interfaceFor(Segment.CLUSTER);
        String ip = addressFor(node.getName(), Segment.CLUSTER);

        return ImmutableList.of(
                NetworkCommand.of("bring up " + iface, IpCommands.linkUp(iface)),
                NetworkCommand.of("flush " + iface, IpCommands.flushAddresses(iface)),
                NetworkCommand.of("assign " + ip, IpCommands.addAddress(ip, profile.getPrefixLength(), iface))
        );
    }

    @Override
    public void validate() {
        if (profile.getKind() != TopologyKind.FLAT) {
            throw new ConfigurationException("Not a flat profile: " + profile.getKind());
        }
        if (profile.interfaceFor(Segment.CLUSTER).equals(profile.getManagementInterface())) {
            throw new ConfigurationException("Cluster segment can't use the management interface");
        }
    }
}
