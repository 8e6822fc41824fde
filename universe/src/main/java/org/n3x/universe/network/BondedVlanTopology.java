package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.BondSpec;
import org.n3x.universe.topology.InvalidBondSpecException;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;

/**
 * An active-backup bond of the data links with the VLANs of {@link VlanTopology} layered on top.
 */
public class BondedVlanTopology extends VlanTopology {

    public BondedVlanTopology(@NonNull TopologyProfile profile) {
        super(profile);
    }

    @Override
    public TopologyKind kind() {
        return TopologyKind.BONDED_VLAN;
    }

    @Override
    public ImmutableList<NetworkCommand> configure(NodeSpec node) {
        BondSpec bond = bond();
        String bondName = bond.getName();

        ImmutableList.Builder<NetworkCommand> plan = ImmutableList.builder();
        plan.add(NetworkCommand.of("load bonding module", IpCommands.loadModule(IpCommands.BONDING_MODULE)));
        plan.add(NetworkCommand.of("load vlan module", IpCommands.loadModule(IpCommands.VLAN_MODULE)));
        plan.add(NetworkCommand.unlessExists(
                String.format("create %s (%s)", bondName, bond.getMode()), bondName, IpCommands.addBond(bond)
        ));

        // members must be down to be enslaved
        for (String member : bond.getMembers()) {
            plan.add(NetworkCommand.unlessEnslaved(
                    "take down " + member, member, bondName, IpCommands.linkDown(member)
            ));
            plan.add(NetworkCommand.unlessEnslaved(
                    "enslave " + member, member, bondName, IpCommands.enslave(member, bondName)
            ));
        }

        plan.add(NetworkCommand.of("bring up " + bondName, IpCommands.linkUp(bondName)));
        for (String member : bond.getMembers()) {
            plan.add(NetworkCommand.of("bring up " + member, IpCommands.linkUp(member)));
        }

        if (bond.getPrimary() != null) {
            plan.add(NetworkCommand.of("prefer " + bond.getPrimary(), IpCommands.setBondPrimary(bond)));
        }

        plan.addAll(vlanLayer(node));
        return plan.build();
    }

    @Override
    public void validate() {
        super.validate();
        bond().validate(profile.getManagementInterface());
    }

    private BondSpec bond() {
        return profile.bondSpec()
                .orElseThrow(() -> new InvalidBondSpecException("Topology " + kind() + " requires a bond"));
    }
}
