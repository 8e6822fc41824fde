package org.n3x.cli;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.n3x.universe.node.InvalidNodeSpecException;
import org.n3x.universe.node.NodeRole;
import org.n3x.universe.node.NodeSpec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class NodeMapParserTest {
    private static final String IMAGE = "n3x/k3s-node:test";

    @Test
    public void testParseRoleMap() {
        ImmutableList<NodeSpec> nodes = NodeMapParser.parse(
                "server-1=server, server-2=server:primary ,agent-1=agent", IMAGE
        );

        assertThat(nodes)
                .extracting(NodeSpec::getName, NodeSpec::getRole, NodeSpec::isPrimary, NodeSpec::getImage)
                .containsExactly(
                        tuple("server-1", NodeRole.SERVER, false, IMAGE),
                        tuple("server-2", NodeRole.SERVER, true, IMAGE),
                        tuple("agent-1", NodeRole.AGENT, false, IMAGE)
                );
    }

    @Test
    public void testFirstServerBecomesPrimary() {
        ImmutableList<NodeSpec> nodes = NodeMapParser.parse("agent-1=agent,server-b=server,server-a=server", IMAGE);

        assertThat(nodes).filteredOn(NodeSpec::isPrimary)
                .extracting(NodeSpec::getName)
                .containsExactly("server-b");
    }

    @Test
    public void testMalformedEntries() {
        assertThatThrownBy(() -> NodeMapParser.parse("", IMAGE))
                .isInstanceOf(InvalidNodeSpecException.class);
        assertThatThrownBy(() -> NodeMapParser.parse("server-1", IMAGE))
                .hasMessageContaining("expected <name>=<role>[:primary]");
        assertThatThrownBy(() -> NodeMapParser.parse("=server", IMAGE))
                .isInstanceOf(InvalidNodeSpecException.class);
        assertThatThrownBy(() -> NodeMapParser.parse("server-1=server:leader", IMAGE))
                .hasMessageContaining("Unknown node flag: leader");
        assertThatThrownBy(() -> NodeMapParser.parse("server-1=server:primary:x", IMAGE))
                .hasMessageContaining("Invalid node role");
        assertThatThrownBy(() -> NodeMapParser.parse("server-1=controller", IMAGE))
                .hasMessageContaining("Unknown node role: controller");
    }
}
