package org.n3x.universe.formation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyProfile;

/**
 * A node joining the cluster: its identity, the token and the primary's API endpoint.
 * <p>
 * The endpoint is always the primary's address on the {@link Segment#CLUSTER} segment, never the
 * management (NAT) interface of the VM.
 */
@Getter
@EqualsAndHashCode
@ToString
public class JoinRequest {

    @NonNull
    private final NodeSpec node;

    @NonNull
    private final ClusterToken token;

    @NonNull
    private final String endpointHost;

    private final int endpointPort;

    private JoinRequest(NodeSpec node, ClusterToken token, String endpointHost, int endpointPort) {
        this.node = node;
        this.token = token;
        this.endpointHost = endpointHost;
        this.endpointPort = endpointPort;
    }

    public static JoinRequest toPrimary(@NonNull NodeSpec node, @NonNull ClusterToken token,
                                        @NonNull TopologyProfile profile, @NonNull NodeSpec primary, int apiPort) {
        if (node.isPrimary()) {
            throw new IllegalArgumentException("The primary initializes the cluster, it doesn't join: " + node.getName());
        }

        String host = profile.addressFor(primary.getName(), Segment.CLUSTER);
        return new JoinRequest(node, token, host, apiPort);
    }

    public String getEndpoint() {
        return String.format("https://%s:%d", endpointHost, endpointPort);
    }
}
