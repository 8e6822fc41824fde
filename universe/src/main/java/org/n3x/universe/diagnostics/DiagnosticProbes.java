package org.n3x.universe.diagnostics;

import com.google.common.collect.ImmutableList;
import org.n3x.universe.fleet.ShellCommand;

import java.util.List;

public class DiagnosticProbes {
    public static final int LOG_TAIL_LINES = 100;

    private DiagnosticProbes() {
        //prevent creating class util instances
    }

    /**
     * Service log tails and status, processes, sockets, interfaces, routes, firewall, config files and disk usage.
     *
     * @param units       systemd units of the clustered service
     * @param configFiles service config/env files
     */
    public static ImmutableList<DiagnosticProbe> standard(List<String> units, List<String> configFiles) {
        ImmutableList.Builder<DiagnosticProbe> probes = ImmutableList.builder();

        for (String unit : units) {
            probes.add(DiagnosticProbe.of("journal " + unit, ShellCommand.of(
                    "journalctl", "-u", unit, "--no-pager", "-n", String.valueOf(LOG_TAIL_LINES)
            )));
            probes.add(DiagnosticProbe.of("status " + unit, ShellCommand.of(
                    "systemctl", "status", unit, "--no-pager"
            )));
        }

        probes.add(DiagnosticProbe.of("processes", ShellCommand.shell("ps aux | grep -E 'k3s|containerd' | grep -v grep")));
        probes.add(DiagnosticProbe.of("listening sockets", ShellCommand.of("ss", "-tlnp")));
        probes.add(DiagnosticProbe.of("interfaces", ShellCommand.of("ip", "addr", "show")));
        probes.add(DiagnosticProbe.of("routes", ShellCommand.of("ip", "route", "show")));
        probes.add(DiagnosticProbe.of("firewall", ShellCommand.of("iptables", "-L", "-n")));

        for (String file : configFiles) {
            probes.add(DiagnosticProbe.of("file " + file, ShellCommand.of("cat", file)));
        }

        probes.add(DiagnosticProbe.of("disk usage", ShellCommand.of("df", "-h")));
        return probes.build();
    }
}
