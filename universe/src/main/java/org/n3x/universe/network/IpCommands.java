package org.n3x.universe.network;

import org.n3x.universe.fleet.ShellCommand;
import org.n3x.universe.topology.BondSpec;

/**
 * iproute2 / systemd command builders
 */
public class IpCommands {
    public static final String NETWORK_DAEMON = "systemd-networkd.service";
    public static final String NETWORK_DAEMON_SOCKET = "systemd-networkd.socket";
    public static final String VLAN_MODULE = "8021q";
    public static final String BONDING_MODULE = "bonding";

    private IpCommands() {
        // prevent instantiation of this class
    }

    /**
     * Mask the automatic network manager, so a later restart of any unit can't bring it back
     */
    public static ShellCommand maskNetworkDaemon() {
        return ShellCommand.of("systemctl", "mask", NETWORK_DAEMON, NETWORK_DAEMON_SOCKET);
    }

    public static ShellCommand stopNetworkDaemon() {
        return ShellCommand.of("systemctl", "stop", NETWORK_DAEMON, NETWORK_DAEMON_SOCKET).tolerated();
    }

    public static ShellCommand loadModule(String module) {
        return ShellCommand.of("modprobe", module);
    }

    public static ShellCommand linkUp(String device) {
        return ShellCommand.of("ip", "link", "set", device, "up");
    }

    public static ShellCommand linkDown(String device) {
        return ShellCommand.of("ip", "link", "set", device, "down");
    }

    /**
     * Exits nonzero if the device doesn't exist
     */
    public static ShellCommand linkShow(String device) {
        return ShellCommand.of("ip", "-o", "link", "show", "dev", device);
    }

    /**
     * Link details, including the vlan protocol and tag of a vlan device
     */
    public static ShellCommand linkDetails(String device) {
        return ShellCommand.of("ip", "-d", "link", "show", "dev", device);
    }

    public static ShellCommand flushAddresses(String device) {
        return ShellCommand.of("ip", "addr", "flush", "dev", device);
    }

    public static ShellCommand addAddress(String ip, int prefixLength, String device) {
        return ShellCommand.of("ip", "addr", "add", ip + "/" + prefixLength, "dev", device);
    }

    public static ShellCommand showAddresses(String device) {
        return ShellCommand.of("ip", "-o", "-4", "addr", "show", "dev", device);
    }

    public static ShellCommand showAllAddresses() {
        return ShellCommand.of("ip", "-br", "addr", "show");
    }

    public static ShellCommand showRoutes() {
        return ShellCommand.of("ip", "route", "show");
    }

    public static ShellCommand addVlan(String trunk, String device, int tag) {
        return ShellCommand.of("ip", "link", "add", "link", trunk, "name", device, "type", "vlan", "id",
                String.valueOf(tag));
    }

    public static ShellCommand addBond(BondSpec bond) {
        return ShellCommand.of("ip", "link", "add", bond.getName(), "type", "bond",
                "mode", bond.getMode().getKernelName(),
                "miimon", String.valueOf(bond.getMonitorIntervalMs()),
                "updelay", String.valueOf(bond.getUpDelayMs()),
                "downdelay", String.valueOf(bond.getDownDelayMs()));
    }

    public static ShellCommand setBondPrimary(BondSpec bond) {
        return ShellCommand.of("ip", "link", "set", bond.getName(), "type", "bond", "primary", bond.getPrimary());
    }

    public static ShellCommand enslave(String member, String bond) {
        return ShellCommand.of("ip", "link", "set", member, "master", bond);
    }

    public static ShellCommand bondStatus(String bond) {
        return ShellCommand.of("cat", "/proc/net/bonding/" + bond);
    }

    public static ShellCommand setHostname(String hostname) {
        return ShellCommand.of("hostname", hostname);
    }

    public static ShellCommand replaceDefaultRoute(String gateway, String device) {
        return ShellCommand.of("ip", "route", "replace", "default", "via", gateway, "dev", device).tolerated();
    }
}
