package org.n3x.universe.topology;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.HashSet;
import java.util.Set;

/**
 * Bond device parameters.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class BondSpec {
    public static final String DEFAULT_NAME = "bond0";

    @Default
    @NonNull
    private final String name = DEFAULT_NAME;

    @Default
    @NonNull
    private final BondMode mode = BondMode.ACTIVE_BACKUP;

    @Singular
    private final ImmutableList<String> members;

    /**
     * Preferred active member in active-backup mode. Optional.
     */
    private final String primary;

    @Default
    private final int monitorIntervalMs = 100;

    @Default
    private final int upDelayMs = 200;

    @Default
    private final int downDelayMs = 200;

    /**
     * @param managementInterface the VM's management/NAT interface, never a bond member
     * @throws InvalidBondSpecException if the bond can't be built
     */
    public void validate(String managementInterface) {
        if (members.isEmpty()) {
            throw new InvalidBondSpecException("Bond " + name + " has no members");
        }

        Set<String> unique = new HashSet<>(members);
        if (unique.size() != members.size()) {
            throw new InvalidBondSpecException("Bond " + name + " lists a member twice: " + members);
        }

        if (members.contains(managementInterface)) {
            throw new InvalidBondSpecException(String.format(
                    "Bond %s must not enslave the management interface %s", name, managementInterface
            ));
        }

        if (members.contains(name)) {
            throw new InvalidBondSpecException("Bond " + name + " can't enslave itself");
        }

        if (primary != null && !members.contains(primary)) {
            throw new InvalidBondSpecException(String.format(
                    "Bond %s primary member %s is not one of %s", name, primary, members
            ));
        }

        if (mode == BondMode.LACP) {
            throw new InvalidBondSpecException(
                    "Bond mode 802.3ad is not supported: the virtual switch does not negotiate LACP"
            );
        }

        if (monitorIntervalMs <= 0) {
            throw new InvalidBondSpecException("Bond " + name + " link monitoring must be enabled");
        }
    }

    /**
     * Kernel bonding modes.
     */
    public enum BondMode {
        @SerializedName("active-backup")
        ACTIVE_BACKUP("active-backup"),

        @SerializedName("balance-rr")
        BALANCE_RR("balance-rr"),

        @SerializedName("balance-xor")
        BALANCE_XOR("balance-xor"),

        @SerializedName("802.3ad")
        LACP("802.3ad");

        @Getter
        private final String kernelName;

        BondMode(String kernelName) {
            this.kernelName = kernelName;
        }

        @Override
        public String toString() {
            return kernelName;
        }
    }
}
