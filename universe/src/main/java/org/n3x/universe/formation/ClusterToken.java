package org.n3x.universe.formation;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Join secret read from the primary after its local bootstrap. Immutable, never printed.
 */
@EqualsAndHashCode
public final class ClusterToken {

    @Getter
    private final String value;

    private ClusterToken(String value) {
        this.value = value;
    }

    public static ClusterToken of(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty cluster token");
        }
        return new ClusterToken(raw.trim());
    }

    @Override
    public String toString() {
        return "ClusterToken(****)";
    }
}
