package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.scenario.fixture.Fixtures;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.topology.TopologyProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ServiceFlagsTest {

    private final ImmutableList<NodeSpec> nodes = Fixtures.threeNodes();
    private final TopologyProfile profile = TopologyProfiles.vlan(nodes);
    private final ServiceFlags flags = new ServiceFlags(profile, ServiceParams.defaults());
    private final NodeSpec primary = nodes.get(0);
    private final NodeSpec secondary = nodes.get(1);
    private final NodeSpec agent = nodes.get(2);
    private final ClusterToken token = ClusterToken.of("K10abc::server:secret\n");

    @Test
    public void testPrimaryInitializesTheCluster() {
        String env = flags.primaryEnv(primary);

        assertThat(env)
                .startsWith("K3S_SERVER_OPTS=\"")
                .contains("--cluster-init")
                .contains("--node-ip=192.168.200.1")
                .contains("--advertise-address=192.168.200.1")
                .contains("--flannel-iface=eth1.200")
                .contains("--disable=traefik")
                .doesNotContain("--server=")
                .doesNotContain("K3S_TOKEN");
    }

    @Test
    public void testJoinUsesThePrimaryClusterAddress() {
        JoinRequest request = JoinRequest.toPrimary(secondary, token, profile, primary, 6443);

        assertThat(request.getEndpoint()).isEqualTo("https://192.168.200.1:6443");
        assertThat(flags.serverJoinEnv(request, primary))
                .contains("--server=https://192.168.200.1:6443")
                .contains("--tls-san=192.168.200.1")
                .contains("K3S_TOKEN=K10abc::server:secret\n")
                .doesNotContain("--cluster-init");
    }

    @Test
    public void testAgentEnv() {
        JoinRequest request = JoinRequest.toPrimary(agent, token, profile, primary, 6443);

        assertThat(flags.agentJoinEnv(request))
                .contains("K3S_URL=https://192.168.200.1:6443\n")
                .contains("--node-ip=192.168.200.3")
                .doesNotContain("--advertise-address");
    }

    @Test
    public void testPrimaryDoesNotJoin() {
        assertThatThrownBy(() -> JoinRequest.toPrimary(primary, token, profile, primary, 6443))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("server-1");
    }

    @Test
    public void testTokenIsNeverPrinted() {
        assertThat(token.toString()).doesNotContain("secret");
        assertThat(JoinRequest.toPrimary(agent, token, profile, primary, 6443).toString()).doesNotContain("secret");
        assertThatThrownBy(() -> ClusterToken.of("  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
