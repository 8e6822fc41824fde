package org.n3x.universe.formation;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyProfile;

/**
 * Command line flags and env files of the clustered service.
 * Every address used here comes from the cluster segment.
 */
@AllArgsConstructor
public class ServiceFlags {

    @NonNull
    private final TopologyProfile profile;

    @NonNull
    private final ServiceParams params;

    /**
     * Flags shared by servers and agents: the node address and the interface carrying pod traffic
     */
    public ImmutableList<String> commonFlags(NodeSpec node) {
        return ImmutableList.of(
                "--node-ip=" + clusterIp(node),
                "--flannel-iface=" + profile.interfaceFor(Segment.CLUSTER)
        );
    }

    /**
     * @param node    a server
     * @param primary the primary server, the node itself for cluster initialization
     */
    public ImmutableList<String> serverFlags(NodeSpec node, NodeSpec primary) {
        ImmutableList.Builder<String> flags = ImmutableList.builder();
        flags.addAll(commonFlags(node));
        flags.add("--node-name=" + node.getName());
        flags.add("--advertise-address=" + clusterIp(node));
        flags.add("--tls-san=" + clusterIp(primary));
        flags.add("--write-kubeconfig-mode=" + params.getKubeconfigMode());
        for (String component : params.getDisabledComponents()) {
            flags.add("--disable=" + component);
        }
        flags.add("--cluster-cidr=" + profile.getClusterCidr());
        flags.add("--service-cidr=" + profile.getServiceCidr());

        if (node.isPrimary()) {
            flags.add("--cluster-init");
        }
        return flags.build();
    }

    public ImmutableList<String> agentFlags(NodeSpec node) {
        return ImmutableList.<String>builder()
                .addAll(commonFlags(node))
                .add("--node-name=" + node.getName())
                .build();
    }

    /**
     * Env file of the primary, initializing a new cluster
     */
    public String primaryEnv(NodeSpec primary) {
        return "K3S_SERVER_OPTS=\"" + join(serverFlags(primary, primary)) + "\"\n";
    }

    /**
     * Env file of a secondary server joining through the request endpoint
     */
    public String serverJoinEnv(JoinRequest request, NodeSpec primary) {
        ImmutableList<String> flags = ImmutableList.<String>builder()
                .addAll(serverFlags(request.getNode(), primary))
                .add("--server=" + request.getEndpoint())
                .build();

        return "K3S_SERVER_OPTS=\"" + join(flags) + "\"\n"
                + "K3S_TOKEN=" + request.getToken().getValue() + "\n";
    }

    public String agentJoinEnv(JoinRequest request) {
        return "K3S_URL=" + request.getEndpoint() + "\n"
                + "K3S_TOKEN=" + request.getToken().getValue() + "\n"
                + "K3S_AGENT_OPTS=\"" + join(agentFlags(request.getNode())) + "\"\n";
    }

    private String clusterIp(NodeSpec node) {
        return profile.addressFor(node.getName(), Segment.CLUSTER);
    }

    private static String join(ImmutableList<String> flags) {
        return Joiner.on(' ').join(flags);
    }
}
