package org.n3x.universe.topology;

import com.google.gson.annotations.SerializedName;

/**
 * Semantic network interfaces. A topology maps each segment to a concrete interface name.
 */
public enum Segment {
    /**
     * Control plane and pod traffic. Join requests always target the primary's address on this segment.
     */
    @SerializedName("cluster")
    CLUSTER,

    @SerializedName("storage")
    STORAGE
}
