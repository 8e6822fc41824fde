package org.n3x.universe.node;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Builder
@Getter
@ToString(exclude = "lifecycle")
public class VmNode implements Node {

    @NonNull
    private final NodeSpec spec;

    @NonNull
    private final String instanceId;

    @NonNull
    private final NodeLifecycle lifecycle;

    public static VmNode of(NodeSpec spec, String instanceId) {
        return VmNode.builder()
                .spec(spec)
                .instanceId(instanceId)
                .lifecycle(new NodeLifecycle(spec.getName()))
                .build();
    }
}
