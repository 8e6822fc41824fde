package org.n3x.universe.topology;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.n3x.universe.node.NodeRole;
import org.n3x.universe.node.NodeSpec;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in topology profiles. Addresses are handed out in formation order: the primary gets host number 1,
 * then the other servers, then agents.
 */
public class TopologyProfiles {
    public static final String FLAT_NETWORK = "192.168.1";
    public static final String FLAT_GATEWAY = FLAT_NETWORK + ".254";
    public static final String CLUSTER_VLAN_NETWORK = "192.168.200";
    public static final String STORAGE_VLAN_NETWORK = "192.168.100";
    public static final int CLUSTER_VLAN_TAG = 200;
    public static final int STORAGE_VLAN_TAG = 100;

    public static final String TRUNK_INTERFACE = "eth1";
    public static final String SECOND_BOND_MEMBER = "eth2";

    private TopologyProfiles() {
        //prevent creating class util instances
    }

    public static TopologyProfile forKind(TopologyKind kind, Collection<NodeSpec> nodes) {
        switch (kind) {
            case FLAT:
                return flat(nodes);
            case VLAN:
                return vlan(nodes);
            case BONDED_VLAN:
                return bondedVlan(nodes);
            default:
                throw new IllegalArgumentException("Unknown topology: " + kind);
        }
    }

    /**
     * Single untagged cluster network on eth1
     */
    public static TopologyProfile flat(Collection<NodeSpec> nodes) {
        Map<String, Map<Segment, String>> addresses = new LinkedHashMap<>();
        ImmutableList<NodeSpec> ordered = ImmutableList.sortedCopyOf(nodes);
        for (int i = 0; i < ordered.size(); i++) {
            addresses.put(ordered.get(i).getName(), ImmutableMap.of(Segment.CLUSTER, host(FLAT_NETWORK, i)));
        }

        return TopologyProfile.builder()
                .kind(TopologyKind.FLAT)
                .interfaces(ImmutableMap.of(Segment.CLUSTER, TRUNK_INTERFACE))
                .addresses(addresses)
                .gateway(FLAT_GATEWAY)
                .build();
    }

    /**
     * Cluster (tag 200) and storage (tag 100) VLANs on the eth1 trunk
     */
    public static TopologyProfile vlan(Collection<NodeSpec> nodes) {
        return tagged(TopologyKind.VLAN, TRUNK_INTERFACE, null, nodes);
    }

    /**
     * Same VLANs as {@link #vlan(Collection)}, layered on an active-backup bond of eth1 and eth2
     */
    public static TopologyProfile bondedVlan(Collection<NodeSpec> nodes) {
        BondSpec bond = BondSpec.builder()
                .name(BondSpec.DEFAULT_NAME)
                .mode(BondSpec.BondMode.ACTIVE_BACKUP)
                .member(TRUNK_INTERFACE)
                .member(SECOND_BOND_MEMBER)
                .primary(TRUNK_INTERFACE)
                .build();

        return tagged(TopologyKind.BONDED_VLAN, bond.getName(), bond, nodes);
    }

    private static TopologyProfile tagged(TopologyKind kind, String trunk, BondSpec bond, Collection<NodeSpec> nodes) {
        Map<String, Map<Segment, String>> addresses = new LinkedHashMap<>();
        ImmutableList<NodeSpec> ordered = ImmutableList.sortedCopyOf(nodes);
        for (int i = 0; i < ordered.size(); i++) {
            addresses.put(ordered.get(i).getName(), ImmutableMap.of(
                    Segment.CLUSTER, host(CLUSTER_VLAN_NETWORK, i),
                    Segment.STORAGE, host(STORAGE_VLAN_NETWORK, i)
            ));
        }

        return TopologyProfile.builder()
                .kind(kind)
                .trunkInterface(trunk)
                .interfaces(ImmutableMap.of(
                        Segment.CLUSTER, trunk + "." + CLUSTER_VLAN_TAG,
                        Segment.STORAGE, trunk + "." + STORAGE_VLAN_TAG
                ))
                .vlanIds(ImmutableMap.of(Segment.CLUSTER, CLUSTER_VLAN_TAG, Segment.STORAGE, STORAGE_VLAN_TAG))
                .bondSpec(bond)
                .addresses(addresses)
                .build();
    }

    private static String host(String network, int index) {
        return network + "." + (index + 1);
    }

    /**
     * The four node fleet of the reference deployment: two servers, two agents
     */
    public static ImmutableList<NodeSpec> defaultNodes() {
        return ImmutableList.of(
                NodeSpec.builder().name("server-1").role(NodeRole.SERVER).primary(true).build(),
                NodeSpec.builder().name("server-2").role(NodeRole.SERVER).build(),
                NodeSpec.builder().name("agent-1").role(NodeRole.AGENT).build(),
                NodeSpec.builder().name("agent-2").role(NodeRole.AGENT).build()
        );
    }
}
