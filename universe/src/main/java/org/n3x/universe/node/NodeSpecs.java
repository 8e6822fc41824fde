package org.n3x.universe.node;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node set helpers
 */
public class NodeSpecs {

    private NodeSpecs() {
        //prevent creating class util instances
    }

    /**
     * Checks the node set: unique names, at least one server, exactly one primary which must be a server.
     *
     * @param nodes node set
     * @return the nodes in formation order
     * @throws InvalidNodeSpecException if the node set is inconsistent
     */
    public static ImmutableList<NodeSpec> validate(Collection<NodeSpec> nodes) {
        if (nodes.isEmpty()) {
            throw new InvalidNodeSpecException("Empty node set");
        }

        Set<String> names = new HashSet<>();
        for (NodeSpec node : nodes) {
            if (!names.add(node.getName())) {
                throw new InvalidNodeSpecException("Duplicate node name: " + node.getName());
            }
            if (node.isPrimary() && node.isAgent()) {
                throw new InvalidNodeSpecException("An agent can't be primary: " + node.getName());
            }
        }

        List<String> primaries = nodes.stream()
                .filter(NodeSpec::isPrimary)
                .map(NodeSpec::getName)
                .collect(Collectors.toList());

        if (primaries.size() != 1) {
            throw new InvalidNodeSpecException("Exactly one primary server required, found: " + primaries);
        }

        return ImmutableList.sortedCopyOf(nodes);
    }

    public static NodeSpec primary(Collection<NodeSpec> nodes) {
        return nodes.stream()
                .filter(NodeSpec::isPrimary)
                .findFirst()
                .orElseThrow(() -> new InvalidNodeSpecException("No primary server"));
    }

    public static ImmutableList<NodeSpec> secondaryServers(Collection<NodeSpec> nodes) {
        return nodes.stream()
                .filter(node -> node.isServer() && !node.isPrimary())
                .sorted()
                .collect(ImmutableList.toImmutableList());
    }

    public static ImmutableList<NodeSpec> agents(Collection<NodeSpec> nodes) {
        return nodes.stream()
                .filter(NodeSpec::isAgent)
                .sorted()
                .collect(ImmutableList.toImmutableList());
    }
}
