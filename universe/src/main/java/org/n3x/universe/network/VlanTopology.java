package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.universe.ConfigurationException;

/**
 * Tagged sub-interfaces on a trunk, one per segment.
 */
public class VlanTopology implements TopologyStrategy {

    @NonNull
    protected final TopologyProfile profile;

    public VlanTopology(@NonNull TopologyProfile profile) {
        this.profile = profile;
    }

    @Override
    public TopologyKind kind() {
        return TopologyKind.VLAN;
    }

    @Override
    public TopologyProfile profile() {
        return profile;
    }

    @Override
    public ImmutableList<NetworkCommand> configure(NodeSpec node) {
        ImmutableList.Builder<NetworkCommand> plan = ImmutableList.builder();
        plan.add(NetworkCommand.of("load vlan module", IpCommands.loadModule(IpCommands.VLAN_MODULE)));
        plan.add(NetworkCommand.of("bring up trunk", IpCommands.linkUp(profile.getTrunkInterface())));
        plan.addAll(vlanLayer(node));
        return plan.build();
    }

    /**
     * Create, address and bring up the tagged sub-interfaces on the trunk
     */
    protected ImmutableList<NetworkCommand> vlanLayer(NodeSpec node) {
        ImmutableList.Builder<NetworkCommand> plan = ImmutableList.builder();
        String trunk = profile.getTrunkInterface();

        for (Segment segment : profile.requiredSegments()) {
            String device = profile.interfaceFor(segment);
            int tag = profile.vlanTag(segment)
                    .orElseThrow(() -> new ConfigurationException("No VLAN tag for segment " + segment));
            String ip = addressFor(node.getName(), segment);

            plan.add(NetworkCommand.unlessExists(
                    String.format("create %s (vlan %d on %s)", device, tag, trunk),
                    device,
                    IpCommands.addVlan(trunk, device, tag)
            ));
            plan.add(NetworkCommand.of("flush " + device, IpCommands.flushAddresses(device)));
            plan.add(NetworkCommand.of("assign " + ip, IpCommands.addAddress(ip, profile.getPrefixLength(), device)));
            plan.add(NetworkCommand.of("bring up " + device, IpCommands.linkUp(device)));
        }

        return plan.build();
    }

    @Override
    public void validate() {
        if (profile.getKind() != kind()) {
            throw new ConfigurationException(String.format("Not a %s profile: %s", kind(), profile.getKind()));
        }
        if (profile.getManagementInterface().equals(profile.getTrunkInterface())) {
            throw new ConfigurationException("VLANs can't be layered on the management interface");
        }
        for (Segment segment : profile.requiredSegments()) {
            if (!profile.vlanTag(segment).isPresent()) {
                throw new ConfigurationException("No VLAN tag for segment " + segment);
            }
        }
    }
}
