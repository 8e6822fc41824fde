package org.n3x.universe.node;

import java.util.Arrays;

public enum NodeRole {
    SERVER("server"), AGENT("agent");

    private final String roleName;

    NodeRole(String roleName) {
        this.roleName = roleName;
    }

    public static NodeRole fromName(String name) {
        return Arrays.stream(values())
                .filter(role -> role.roleName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new InvalidNodeSpecException("Unknown node role: " + name));
    }

    @Override
    public String toString() {
        return roleName;
    }
}
