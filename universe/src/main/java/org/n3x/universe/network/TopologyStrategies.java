package org.n3x.universe.network;

import org.n3x.universe.topology.TopologyProfile;

public class TopologyStrategies {

    private TopologyStrategies() {
        //prevent creating class util instances
    }

    /**
     * Strategy matching the profile kind, validated
     */
    public static TopologyStrategy forProfile(TopologyProfile profile) {
        final TopologyStrategy strategy;
        switch (profile.getKind()) {
            case FLAT:
                strategy = new FlatTopology(profile);
                break;
            case VLAN:
                strategy = new VlanTopology(profile);
                break;
            case BONDED_VLAN:
                strategy = new BondedVlanTopology(profile);
                break;
            default:
                throw new IllegalArgumentException("Unknown topology: " + profile.getKind());
        }

        strategy.validate();
        return strategy;
    }
}
