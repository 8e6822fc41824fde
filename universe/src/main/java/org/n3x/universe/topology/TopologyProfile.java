package org.n3x.universe.topology;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.InetAddresses;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeSpecs;
import org.n3x.universe.universe.ConfigurationException;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative network layout of a validation run: which concrete interface carries each {@link Segment},
 * the static address of every node on every segment, optional VLAN tags and an optional bond.
 * <p>
 * A profile is validated when it is built, so a broken profile never reaches the VM fleet.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TopologyProfile {
    public static final String DEFAULT_MANAGEMENT_INTERFACE = "eth0";
    public static final int DEFAULT_PREFIX_LENGTH = 24;
    public static final String DEFAULT_CLUSTER_CIDR = "10.42.0.0/16";
    public static final String DEFAULT_SERVICE_CIDR = "10.43.0.0/16";
    public static final int MIN_VLAN_TAG = 1;
    public static final int MAX_VLAN_TAG = 4094;

    @NonNull
    private final TopologyKind kind;

    @NonNull
    private final String managementInterface;

    /**
     * Physical interface (or bond) carrying the tagged sub-interfaces. Null for untagged topologies.
     */
    private final String trunkInterface;

    @NonNull
    private final ImmutableMap<Segment, String> interfaces;

    @NonNull
    private final ImmutableMap<String, ImmutableMap<Segment, String>> addresses;

    @NonNull
    private final ImmutableMap<Segment, Integer> vlanIds;

    private final BondSpec bondSpec;

    private final int prefixLength;

    /**
     * Default gateway on the cluster segment. Optional.
     */
    private final String gateway;

    @NonNull
    private final String clusterCidr;

    @NonNull
    private final String serviceCidr;

    @Builder(toBuilder = true)
    private TopologyProfile(@NonNull TopologyKind kind, String managementInterface, String trunkInterface,
                            Map<Segment, String> interfaces, Map<String, ? extends Map<Segment, String>> addresses,
                            Map<Segment, Integer> vlanIds, BondSpec bondSpec, Integer prefixLength,
                            String gateway, String clusterCidr, String serviceCidr) {
        this.kind = kind;
        this.managementInterface = Optional.ofNullable(managementInterface).orElse(DEFAULT_MANAGEMENT_INTERFACE);
        this.trunkInterface = trunkInterface;
        this.interfaces = interfaces == null ? ImmutableMap.of() : ImmutableMap.copyOf(interfaces);
        this.addresses = copyAddresses(addresses);
        this.vlanIds = vlanIds == null ? ImmutableMap.of() : ImmutableMap.copyOf(vlanIds);
        this.bondSpec = bondSpec;
        this.prefixLength = Optional.ofNullable(prefixLength).orElse(DEFAULT_PREFIX_LENGTH);
        this.gateway = gateway;
        this.clusterCidr = Optional.ofNullable(clusterCidr).orElse(DEFAULT_CLUSTER_CIDR);
        this.serviceCidr = Optional.ofNullable(serviceCidr).orElse(DEFAULT_SERVICE_CIDR);

        validate();
    }

    private static ImmutableMap<String, ImmutableMap<Segment, String>> copyAddresses(
            Map<String, ? extends Map<Segment, String>> addresses) {
        if (addresses == null) {
            return ImmutableMap.of();
        }
        ImmutableMap.Builder<String, ImmutableMap<Segment, String>> copy = ImmutableMap.builder();
        addresses.forEach((node, perSegment) -> copy.put(node, ImmutableMap.copyOf(perSegment)));
        return copy.build();
    }

    /**
     * Semantic interface name to concrete interface name
     */
    public ImmutableMap<Segment, String> interfaces() {
        return interfaces;
    }

    public ImmutableSet<Segment> requiredSegments() {
        return kind.getRequiredSegments();
    }

    public String interfaceFor(Segment segment) {
        String iface = interfaces.get(segment);
        if (iface == null) {
            throw new MissingAddressException("No interface declared for segment " + segment);
        }
        return iface;
    }

    /**
     * Static address of a node on a segment.
     *
     * @throws MissingAddressException if the node has no address there
     */
    public String addressFor(String nodeName, Segment segment) {
        Map<Segment, String> perSegment = addresses.get(nodeName);
        if (perSegment == null || !perSegment.containsKey(segment)) {
            throw new MissingAddressException(String.format(
                    "Node %s has no address on segment %s", nodeName, segment
            ));
        }
        return perSegment.get(segment);
    }

    public Optional<Integer> vlanTag(Segment segment) {
        return Optional.ofNullable(vlanIds.get(segment));
    }

    public Optional<BondSpec> bondSpec() {
        return Optional.ofNullable(bondSpec);
    }

    /**
     * Network address of a segment in CIDR notation, derived from the node addresses.
     */
    public Optional<String> networkOf(Segment segment) {
        return addresses.values().stream()
                .map(perSegment -> perSegment.get(segment))
                .filter(ip -> ip != null)
                .findFirst()
                .map(ip -> network(ip, prefixLength) + "/" + prefixLength);
    }

    /**
     * Checks the profile against the node set that is about to be booted.
     *
     * @param nodes node set
     * @throws ConfigurationException if any node misses an address or the node set is inconsistent
     */
    public void validateFor(Collection<NodeSpec> nodes) {
        NodeSpecs.validate(nodes);

        for (NodeSpec node : nodes) {
            for (Segment segment : requiredSegments()) {
                addressFor(node.getName(), segment);
            }
        }
    }

    private void validate() {
        for (Segment segment : requiredSegments()) {
            if (!interfaces.containsKey(segment)) {
                throw new MissingAddressException(String.format(
                        "Topology %s requires an interface for segment %s", kind, segment
                ));
            }
        }

        // a segment the kind does not use would be neither configured nor verified
        checkUsedSegments("interfaces", interfaces.keySet());
        checkUsedSegments("VLAN tags", vlanIds.keySet());
        addresses.forEach((node, perSegment) -> checkUsedSegments("addresses of " + node, perSegment.keySet()));

        if (prefixLength < 1 || prefixLength > 32) {
            throw new ConfigurationException("Invalid prefix length: " + prefixLength);
        }

        validateVlanTags();
        validateBond();
        validateAddresses();

        if (gateway != null && !InetAddresses.isInetAddress(gateway)) {
            throw new ConfigurationException("Invalid gateway address: " + gateway);
        }
    }

    private void checkUsedSegments(String where, Set<Segment> declared) {
        for (Segment segment : declared) {
            if (!requiredSegments().contains(segment)) {
                throw new ConfigurationException(String.format(
                        "Topology %s has no %s segment, remove it from %s", kind, segment, where
                ));
            }
        }
    }

    private void validateVlanTags() {
        if (kind.isTagged()) {
            if (trunkInterface == null) {
                throw new ConfigurationException("Topology " + kind + " requires a trunk interface");
            }
            for (Segment segment : requiredSegments()) {
                if (!vlanIds.containsKey(segment)) {
                    throw new InvalidVlanTagException(String.format(
                            "Topology %s requires a VLAN tag for segment %s", kind, segment
                    ));
                }
            }
        }

        Map<Integer, Segment> seen = new HashMap<>();
        vlanIds.forEach((segment, tag) -> {
            if (tag == null || tag < MIN_VLAN_TAG || tag > MAX_VLAN_TAG) {
                throw new InvalidVlanTagException(String.format(
                        "VLAN tag of segment %s must be within %d-%d, got: %s",
                        segment, MIN_VLAN_TAG, MAX_VLAN_TAG, tag
                ));
            }
            Segment previous = seen.put(tag, segment);
            if (previous != null) {
                throw new DuplicateVlanTagException(String.format(
                        "VLAN tag %d is used by segments %s and %s", tag, previous, segment
                ));
            }
        });
    }

    private void validateBond() {
        if (kind.isBonded() && bondSpec == null) {
            throw new InvalidBondSpecException("Topology " + kind + " requires a bond");
        }
        if (bondSpec == null) {
            return;
        }

        bondSpec.validate(managementInterface);

        if (kind.isTagged() && !bondSpec.getName().equals(trunkInterface)) {
            throw new InvalidBondSpecException(String.format(
                    "VLANs must be layered on the bond %s, trunk is: %s", bondSpec.getName(), trunkInterface
            ));
        }
    }

    private void validateAddresses() {
        Map<Segment, Set<String>> used = new HashMap<>();

        addresses.forEach((node, perSegment) -> {
            for (Segment segment : requiredSegments()) {
                if (!perSegment.containsKey(segment)) {
                    throw new MissingAddressException(String.format(
                            "Node %s has no address on segment %s", node, segment
                    ));
                }
            }

            perSegment.forEach((segment, ip) -> {
                if (!isIpv4(ip)) {
                    throw new ConfigurationException(String.format(
                            "Invalid address of node %s on segment %s: %s", node, segment, ip
                    ));
                }
                if (!used.computeIfAbsent(segment, s -> new HashSet<>()).add(ip)) {
                    throw new ConfigurationException(String.format(
                            "Address %s on segment %s is assigned twice", ip, segment
                    ));
                }
            });
        });

        // segments must not share a network, the health verifier relies on it
        Set<String> networks = new HashSet<>();
        for (Segment segment : interfaces.keySet()) {
            Optional<String> network = networkOf(segment);
            if (network.isPresent() && !networks.add(network.get())) {
                throw new ConfigurationException("Segments share the network " + network.get());
            }
        }
    }

    /**
     * Nodes named in the profile, in no particular order.
     */
    public ImmutableList<String> nodeNames() {
        return addresses.keySet().asList();
    }

    private static boolean isIpv4(String ip) {
        return ip != null && InetAddresses.isInetAddress(ip) && InetAddresses.forString(ip) instanceof Inet4Address;
    }

    /**
     * Network part of an IPv4 address, e.g. 192.168.200.7 with /24 is 192.168.200.0
     */
    public static String network(String ip, int prefixLength) {
        InetAddress address = InetAddresses.forString(ip);
        int value = InetAddresses.coerceToInteger(address);
        int mask = prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
        return InetAddresses.toAddrString(InetAddresses.fromInteger(value & mask));
    }
}
