package org.n3x.universe.node;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Resource limits of a VM
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class NodeResources {

    @Default
    private final int memoryMb = 3072;

    @Default
    private final int cores = 2;

    @Default
    private final int diskMb = 20480;

    public static NodeResources defaults() {
        return NodeResources.builder().build();
    }
}
