package org.n3x.universe.topology;

import com.google.common.collect.ImmutableSet;
import com.google.gson.annotations.SerializedName;
import lombok.Getter;
import org.n3x.universe.universe.ConfigurationException;

import java.util.Arrays;

public enum TopologyKind {

    @SerializedName("flat")
    FLAT("flat", false, false, ImmutableSet.of(Segment.CLUSTER)),

    @SerializedName("vlan")
    VLAN("vlan", true, false, ImmutableSet.of(Segment.CLUSTER, Segment.STORAGE)),

    @SerializedName("bonded-vlan")
    BONDED_VLAN("bonded-vlan", true, true, ImmutableSet.of(Segment.CLUSTER, Segment.STORAGE));

    @Getter
    private final String kindName;

    @Getter
    private final boolean tagged;

    @Getter
    private final boolean bonded;

    @Getter
    private final ImmutableSet<Segment> requiredSegments;

    TopologyKind(String kindName, boolean tagged, boolean bonded, ImmutableSet<Segment> requiredSegments) {
        this.kindName = kindName;
        this.tagged = tagged;
        this.bonded = bonded;
        this.requiredSegments = requiredSegments;
    }

    public static TopologyKind fromName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.kindName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown topology: " + name));
    }

    @Override
    public String toString() {
        return kindName;
    }
}
