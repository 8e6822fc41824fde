package org.n3x.universe.health;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetException;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.ShellCommand;
import org.n3x.universe.health.HealthReport.CheckResult;
import org.n3x.universe.health.HealthReport.CheckStatus;
import org.n3x.universe.network.IpCommands;
import org.n3x.universe.node.Node;
import org.n3x.universe.topology.BondSpec;
import org.n3x.universe.topology.Segment;
import org.n3x.universe.topology.TopologyProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-formation checks of every node against the {@link TopologyProfile}.
 * <p>
 * Hard checks: each segment interface exists, carries exactly its address, reports its VLAN tag,
 * and the bond runs active-backup with an active member.
 * Soft checks, reported as warnings only: segment routes go through the segment interface and no other
 * interface carries a segment prefix. VM links share one virtual bridge, so these can't be guaranteed.
 * <p>
 * All checks run even after a failure.
 */
@Slf4j
@Builder
public class HealthVerifier {
    private static final Pattern INET = Pattern.compile("inet (\\d+\\.\\d+\\.\\d+\\.\\d+)/(\\d+)");

    @NonNull
    private final FleetManager fleet;

    @NonNull
    private final TopologyProfile profile;

    /**
     * Run every check on every node
     */
    public HealthReport verify(List<Node> nodes) {
        HealthReport.HealthReportBuilder report = HealthReport.builder();

        for (Node node : nodes) {
            for (Segment segment : profile.requiredSegments()) {
                checkInterface(node, segment).forEach(report::check);
            }
            profile.bondSpec().ifPresent(bond -> report.check(checkBond(node, bond)));
            checkIsolation(node).forEach(report::check);
        }

        HealthReport result = report.build();
        result.getChecks().forEach(check -> {
            if (check.getStatus() == CheckStatus.FAIL) {
                log.error(check.render());
            } else if (check.getStatus() == CheckStatus.WARN) {
                log.warn(check.render());
            } else {
                log.debug(check.render());
            }
        });
        return result;
    }

    /**
     * @throws HealthCheckException if any hard check failed
     */
    public HealthReport verifyOrThrow(List<Node> nodes) {
        HealthReport report = verify(nodes);
        if (!report.isHealthy()) {
            throw new HealthCheckException(report);
        }
        return report;
    }

    List<CheckResult> checkInterface(Node node, Segment segment) {
        List<CheckResult> results = new ArrayList<>();
        String iface = profile.interfaceFor(segment);
        String expected = profile.addressFor(node.getName(), segment) + "/" + profile.getPrefixLength();

        Optional<ExecResult> addresses = exec(node, IpCommands.showAddresses(iface));
        if (!addresses.isPresent() || !addresses.get().isSuccess()) {
            results.add(fail(node, iface + " exists", "interface not found"));
            return results;
        }
        results.add(pass(node, iface + " exists", segment + " interface present"));

        ImmutableSet<String> actual = addressesOf(addresses.get().getOutput());
        if (actual.equals(ImmutableSet.of(expected))) {
            results.add(pass(node, iface + " address", expected));
        } else {
            results.add(fail(node, iface + " address", "expected exactly " + expected + ", found " + actual));
        }

        Optional<Integer> tag = profile.vlanTag(segment);
        if (tag.isPresent()) {
            results.add(checkVlanTag(node, iface, tag.get()));
        }
        return results;
    }

    CheckResult checkVlanTag(Node node, String iface, int tag) {
        String check = iface + " vlan tag";
        Optional<ExecResult> details = exec(node, IpCommands.linkDetails(iface));
        if (!details.isPresent() || !details.get().isSuccess()) {
            return fail(node, check, "link introspection failed");
        }

        String expected = "vlan protocol 802.1q id " + tag + " ";
        String output = details.get().getOutput().toLowerCase(Locale.ROOT).replace("\n", " ") + " ";
        if (output.contains(expected)) {
            return pass(node, check, "802.1Q id " + tag);
        }
        return fail(node, check, "expected 802.1Q id " + tag + ", link reports: " + details.get().getOutput().trim());
    }

    CheckResult checkBond(Node node, BondSpec bond) {
        String check = bond.getName() + " status";
        Optional<ExecResult> proc = exec(node, IpCommands.bondStatus(bond.getName()));
        if (!proc.isPresent() || !proc.get().isSuccess()) {
            return fail(node, check, "bond not found");
        }

        BondStatus status = BondStatus.parse(proc.get().getOutput());
        if (!status.isActiveBackup()) {
            return fail(node, check, "expected active-backup mode, found: " + status.getMode());
        }

        Optional<String> active = status.activeMember();
        if (!active.isPresent() || !bond.getMembers().contains(active.get())) {
            return fail(node, check, "no active member among " + bond.getMembers());
        }
        return pass(node, check, "active-backup, active member " + active.get());
    }

    /**
     * Best-effort segment isolation, never a hard failure
     */
    List<CheckResult> checkIsolation(Node node) {
        List<CheckResult> results = new ArrayList<>();

        Optional<ExecResult> routes = exec(node, IpCommands.showRoutes());
        for (Segment segment : profile.requiredSegments()) {
            String iface = profile.interfaceFor(segment);
            Optional<String> network = profile.networkOf(segment);
            if (!network.isPresent()) {
                continue;
            }

            String route = network.get() + " dev " + iface;
            boolean routed = routes.map(r -> r.isSuccess() && r.getOutput().contains(route)).orElse(false);
            results.add(routed
                    ? pass(node, "route " + network.get(), "via " + iface)
                    : warn(node, "route " + network.get(), "no route via " + iface));
        }

        Optional<ExecResult> brief = exec(node, IpCommands.showAllAddresses());
        if (brief.isPresent() && brief.get().isSuccess()) {
            ImmutableSet<String> segmentIfaces = ImmutableSet.copyOf(profile.interfaces().values());
            for (String line : Splitter.on('\n').trimResults().omitEmptyStrings().split(brief.get().getOutput())) {
                List<String> columns = Splitter.onPattern("\\s+").splitToList(line);
                String iface = columns.get(0).split("@")[0];
                if (segmentIfaces.contains(iface)) {
                    continue;
                }
                for (String column : columns) {
                    foreignSegment(column).ifPresent(segment -> results.add(warn(
                            node, iface + " isolation", "carries " + segment + " address " + column
                    )));
                }
            }
        } else {
            results.add(warn(node, "isolation", "can't list interfaces"));
        }

        return results;
    }

    private Optional<Segment> foreignSegment(String cidr) {
        if (!cidr.contains("/") || !cidr.contains(".")) {
            return Optional.empty();
        }
        String ip = cidr.substring(0, cidr.indexOf('/'));
        for (Segment segment : profile.requiredSegments()) {
            Optional<String> network = profile.networkOf(segment);
            String candidate = TopologyProfile.network(ip, profile.getPrefixLength()) + "/" + profile.getPrefixLength();
            if (network.isPresent() && network.get().equals(candidate)) {
                return Optional.of(segment);
            }
        }
        return Optional.empty();
    }

    static ImmutableSet<String> addressesOf(String ipOutput) {
        ImmutableSet.Builder<String> addresses = ImmutableSet.builder();
        Matcher matcher = INET.matcher(ipOutput);
        while (matcher.find()) {
            addresses.add(matcher.group(1) + "/" + matcher.group(2));
        }
        return addresses.build();
    }

    private Optional<ExecResult> exec(Node node, ShellCommand command) {
        try {
            return Optional.of(fleet.exec(node, command));
        } catch (FleetException ex) {
            log.warn("Health probe `{}` failed on {}: {}", command, node.getName(), ex.getMessage());
            return Optional.empty();
        }
    }

    private static CheckResult pass(Node node, String check, String detail) {
        return CheckResult.of(node.getName(), check, CheckStatus.PASS, detail);
    }

    private static CheckResult warn(Node node, String check, String detail) {
        return CheckResult.of(node.getName(), check, CheckStatus.WARN, detail);
    }

    private static CheckResult fail(Node node, String check, String detail) {
        return CheckResult.of(node.getName(), check, CheckStatus.FAIL, detail);
    }
}
