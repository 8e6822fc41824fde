package org.n3x.cli;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.node.InvalidNodeSpecException;
import org.n3x.universe.node.NodeRole;
import org.n3x.universe.node.NodeSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a node role map: {@code server-1=server:primary,server-2=server,agent-1=agent}.
 * <p>
 * If no server is flagged primary, the first server of the map becomes the primary.
 */
@Slf4j
public class NodeMapParser {
    private static final String PRIMARY_FLAG = "primary";

    private NodeMapParser() {
        //prevent creating instances
    }

    public static ImmutableList<NodeSpec> parse(String nodeMap, String image) {
        if (Strings.isNullOrEmpty(nodeMap)) {
            throw new InvalidNodeSpecException("Empty node map");
        }

        List<NodeSpec> specs = new ArrayList<>();
        for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(nodeMap)) {
            specs.add(parseEntry(entry, image));
        }

        if (specs.stream().noneMatch(NodeSpec::isPrimary)) {
            for (int i = 0; i < specs.size(); i++) {
                NodeSpec spec = specs.get(i);
                if (spec.isServer()) {
                    log.info("No primary in the node map, using {}", spec.getName());
                    specs.set(i, spec.toBuilder().primary(true).build());
                    break;
                }
            }
        }

        return ImmutableList.copyOf(specs);
    }

    private static NodeSpec parseEntry(String entry, String image) {
        List<String> nameAndRole = Splitter.on('=').trimResults().splitToList(entry);
        if (nameAndRole.size() != 2 || nameAndRole.get(0).isEmpty()) {
            throw new InvalidNodeSpecException("Invalid node entry, expected <name>=<role>[:primary]: " + entry);
        }

        List<String> roleAndFlag = Splitter.on(':').trimResults().splitToList(nameAndRole.get(1));
        if (roleAndFlag.size() > 2) {
            throw new InvalidNodeSpecException("Invalid node role: " + nameAndRole.get(1));
        }

        boolean primary = false;
        if (roleAndFlag.size() == 2) {
            if (!PRIMARY_FLAG.equalsIgnoreCase(roleAndFlag.get(1))) {
                throw new InvalidNodeSpecException("Unknown node flag: " + roleAndFlag.get(1));
            }
            primary = true;
        }

        return NodeSpec.builder()
                .name(nameAndRole.get(0))
                .role(NodeRole.fromName(roleAndFlag.get(0)))
                .image(image)
                .primary(primary)
                .build();
    }
}
