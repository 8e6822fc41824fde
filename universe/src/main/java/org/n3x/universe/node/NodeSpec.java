package org.n3x.universe.node;

import com.google.common.collect.ComparisonChain;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Static description of a cluster node. Defined before any VM boots.
 * <p>
 * Specs are ordered the way nodes are brought into the cluster: the primary first,
 * then the remaining servers, then agents, each group by name.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class NodeSpec implements Comparable<NodeSpec> {
    public static final String DEFAULT_IMAGE = "n3x/k3s-node:latest";

    @NonNull
    private final String name;

    @NonNull
    private final NodeRole role;

    @Default
    @NonNull
    private final NodeResources resources = NodeResources.defaults();

    @Default
    @NonNull
    private final String image = DEFAULT_IMAGE;

    /**
     * Initializes a new cluster instead of joining one. Servers only.
     */
    @Default
    private final boolean primary = false;

    public boolean isServer() {
        return role == NodeRole.SERVER;
    }

    public boolean isAgent() {
        return role == NodeRole.AGENT;
    }

    @Override
    public int compareTo(NodeSpec other) {
        return ComparisonChain.start()
                .compareTrueFirst(this.primary, other.primary)
                .compare(this.role, other.role)
                .compare(this.name, other.name)
                .result();
    }
}
