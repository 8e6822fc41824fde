package org.n3x.universe.network;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.SimulatedFleet;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.scenario.fixture.Fixtures;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.topology.TopologyProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class NetworkConfiguratorTest {

    private final ImmutableList<NodeSpec> nodes = Fixtures.threeNodes();
    private final SimulatedFleet fleet = new SimulatedFleet();

    private Node boot(String name) {
        NodeSpec spec = nodes.stream().filter(node -> node.getName().equals(name)).findFirst().get();
        return fleet.boot(spec);
    }

    @Test
    public void testNetworkDaemonIsMaskedFirst() {
        TopologyProfile profile = TopologyProfiles.flat(nodes);
        Node server = boot("server-1");

        Fixtures.configurator(fleet, profile).apply(server);

        List<String> commands = fleet.renderedCommandsOn("server-1");
        assertThat(commands.get(0)).startsWith("systemctl mask systemd-networkd.service");
        assertThat(fleet.isMasked("server-1", IpCommands.NETWORK_DAEMON)).isTrue();
        assertThat(fleet.addressesOf("server-1", "eth1")).containsExactly("192.168.1.1/24");
        assertThat(commands).contains("ip route replace default via 192.168.1.254 dev eth1");
    }

    @Test
    public void testVlanInterfacesCarryTheirTags() {
        TopologyProfile profile = TopologyProfiles.vlan(nodes);
        Node agent = boot("agent-1");

        Fixtures.configurator(fleet, profile).apply(agent);

        assertThat(fleet.vlanTagOf("agent-1", "eth1.200")).hasValue(200);
        assertThat(fleet.vlanTagOf("agent-1", "eth1.100")).hasValue(100);
        assertThat(fleet.addressesOf("agent-1", "eth1.200")).containsExactly("192.168.200.3/24");
        assertThat(fleet.addressesOf("agent-1", "eth1.100")).containsExactly("192.168.100.3/24");
        assertThat(fleet.addressesOf("agent-1", "eth1")).isEmpty();
    }

    @Test
    public void testBondIsActiveBackupWithVlansOnTop() {
        TopologyProfile profile = TopologyProfiles.bondedVlan(nodes);
        Node server = boot("server-2");

        NetworkConfigurator configurator = Fixtures.configurator(fleet, profile);
        configurator.apply(server);

        List<String> commands = fleet.renderedCommandsOn("server-2");
        assertThat(commands).anySatisfy(cmd -> assertThat(cmd).contains("type bond mode active-backup"));
        assertThat(commands).noneSatisfy(cmd -> assertThat(cmd).contains("802.3ad"));
        assertThat(commands).contains("ip link add link bond0 name bond0.200 type vlan id 200");

        int enslave = commands.indexOf("ip link set eth2 master bond0");
        int takeDown = commands.indexOf("ip link set eth2 down");
        assertThat(takeDown).isNotNegative().isLessThan(enslave);

        assertThat(fleet.activeBondMember("server-2", "bond0")).hasValue("eth1");
        assertThat(fleet.addressesOf("server-2", "bond0.200")).containsExactly("192.168.200.2/24");
    }

    @Test
    public void testReapplyingIsIdempotent() {
        TopologyProfile profile = TopologyProfiles.bondedVlan(nodes);
        Node server = boot("server-1");
        NetworkConfigurator configurator = Fixtures.configurator(fleet, profile);

        configurator.apply(server);
        CommandTranscript second = configurator.apply(server);

        assertThat(second.getEntries())
                .filteredOn(CommandTranscript.Entry::isSkipped)
                .extracting(entry -> entry.getCommand().render())
                .contains(
                        "ip link add bond0 type bond mode active-backup miimon 100 updelay 200 downdelay 200",
                        "ip link set eth1 master bond0",
                        "ip link add link bond0 name bond0.100 type vlan id 100"
                );
        assertThat(second.getEntries())
                .filteredOn(entry -> !entry.isSkipped())
                .allSatisfy(entry -> assertThat(entry.getResult().isSuccess()).isTrue());
        assertThat(fleet.addressesOf("server-1", "bond0.200")).containsExactly("192.168.200.1/24");
        assertThat(fleet.addressesOf("server-1", "bond0.100")).containsExactly("192.168.100.1/24");
    }

    @Test
    public void testPlanStartsWithHostPreparation() {
        NetworkConfigurator configurator = Fixtures.configurator(fleet, TopologyProfiles.vlan(nodes));

        ImmutableList<NetworkCommand> plan = configurator.plan(nodes.get(0));

        assertThat(plan).extracting(NetworkCommand::getDescription)
                .startsWith("mask network daemon", "stop network daemon", "set hostname");
        assertThat(configurator.getStrategy()).isInstanceOf(VlanTopology.class);
    }

    @Test
    public void testFailingCommandStopsThePlanWithDiagnostics() {
        TopologyProfile profile = TopologyProfiles.vlan(nodes);
        Node agent = boot("agent-1");
        fleet.respond("agent-1",
                cmd -> cmd.render().startsWith("ip addr add 192.168.100.3"),
                ExecResult.failed(2, "RTNETLINK answers: File exists")
        );

        NetworkApplyException error = catchThrowableOfType(
                () -> Fixtures.configurator(fleet, profile).apply(agent), NetworkApplyException.class
        );

        assertThat(error.getNodeName()).isEqualTo("agent-1");
        assertThat(error).hasMessageContaining("File exists").hasMessageContaining("exit code: 2");
        assertThat(error.getTranscript().executedCommands()).last()
                .extracting(cmd -> cmd.render())
                .isEqualTo("ip addr add 192.168.100.3/24 dev eth1.100");
        assertThat(error.getDiagnostics().getTranscript()).contains("ip addr add 192.168.100.3/24 dev eth1.100");
        assertThat(error.getDiagnostics().getSections()).containsKeys("interfaces", "routes");
        assertThat(fleet.renderedCommandsOn("agent-1")).doesNotContain("ip link set eth1.100 up");
    }

    @Test
    public void testClosedExecChannelIsANetworkFailure() {
        TopologyProfile profile = TopologyProfiles.flat(nodes);
        Node server = boot("server-1");
        fleet.disconnect("server-1");

        assertThatThrownBy(() -> Fixtures.configurator(fleet, profile).apply(server))
                .isInstanceOf(NetworkApplyException.class)
                .hasMessageContaining("exec channel error")
                .satisfies(e -> assertThat(((NetworkApplyException) e).getDiagnostics().isPartial()).isTrue());
    }
}
