package org.n3x.universe.action;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.formation.NodeRegistry;
import org.n3x.universe.formation.ServiceCommands;
import org.n3x.universe.formation.ServiceParams;
import org.n3x.universe.health.BondStatus;
import org.n3x.universe.network.IpCommands;
import org.n3x.universe.node.Node;
import org.n3x.universe.topology.BondSpec;
import org.n3x.util.retry.IntervalAndSentinelRetry.PollOutcome;

import java.time.Duration;

/**
 * Forces one bond member of a node down, waits for the bond to fail over to another member,
 * then checks the cluster still reports every node Ready.
 */
@Slf4j
@Builder
public class BondMemberDownFault implements Action.Fault<BondMemberDownFault.FailoverResult> {

    @NonNull
    private final FleetManager fleet;

    @NonNull
    private final Node node;

    @NonNull
    private final Node primary;

    @NonNull
    private final BondSpec bond;

    /**
     * Member to take down, the bond's currently active member if absent
     */
    private final String member;

    private final int expectedReadyNodes;

    @Default
    @NonNull
    private final ServiceParams serviceParams = ServiceParams.defaults();

    @Default
    @NonNull
    private final Duration timeout = Duration.ofMinutes(2);

    @Override
    public FailoverResult execute() {
        BondStatus before = bondStatus();
        String victim = member != null ? member : before.activeMember()
                .orElseThrow(() -> new ActionException("Bond " + bond.getName() + " has no active member"));

        if (!bond.getMembers().contains(victim)) {
            throw new ActionException(String.format("%s is not a member of %s", victim, bond.getName()));
        }

        log.warn("Fault: taking down {} of {} on {}", victim, bond.getName(), node.getName());
        ExecResult down = fleet.exec(node, IpCommands.linkDown(victim));
        if (!down.isSuccess()) {
            throw new ActionException("Can't take down " + victim + ": " + down.getOutput().trim());
        }

        PollOutcome failover = fleet.waitForCondition(
                node,
                IpCommands.bondStatus(bond.getName()),
                result -> result.isSuccess() && BondStatus.parse(result.getOutput()).activeMember()
                        .map(active -> !active.equals(victim))
                        .orElse(false),
                timeout
        );

        BondStatus after = bondStatus();

        PollOutcome clusterReady = fleet.waitForCondition(
                primary,
                ServiceCommands.getNodes(serviceParams.getKubectl()),
                result -> result.isSuccess() && NodeRegistry.parse(result.getOutput()).readyCount() == expectedReadyNodes,
                timeout
        );

        FailoverResult result = FailoverResult.builder()
                .member(victim)
                .activeBefore(before.activeMember().orElse(null))
                .activeAfter(after.activeMember().orElse(null))
                .failedOver(failover == PollOutcome.SATISFIED)
                .clusterReady(clusterReady == PollOutcome.SATISFIED)
                .build();

        log.info("Bond failover on {}: {}", node.getName(), result);
        return result;
    }

    private BondStatus bondStatus() {
        ExecResult result = fleet.exec(node, IpCommands.bondStatus(bond.getName()));
        if (!result.isSuccess()) {
            throw new ActionException("Can't read status of " + bond.getName() + " on " + node.getName());
        }
        return BondStatus.parse(result.getOutput());
    }

    @Builder
    @Getter
    @ToString
    @EqualsAndHashCode
    public static class FailoverResult {
        private final String member;
        private final String activeBefore;
        private final String activeAfter;
        private final boolean failedOver;
        private final boolean clusterReady;

        public boolean isSuccess() {
            return failedOver && clusterReady;
        }
    }
}
