package org.n3x.universe.universe;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.action.ActionException;
import org.n3x.universe.action.BondMemberDownFault;
import org.n3x.universe.action.BondMemberDownFault.FailoverResult;
import org.n3x.universe.action.TestScriptTask;
import org.n3x.universe.action.TestScriptTask.ScriptResult;
import org.n3x.universe.diagnostics.DiagnosticProbes;
import org.n3x.universe.diagnostics.DiagnosticsCollector;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.formation.ClusterFormationDriver;
import org.n3x.universe.formation.FormationContext;
import org.n3x.universe.formation.FormationTimeoutException;
import org.n3x.universe.health.HealthCheckException;
import org.n3x.universe.health.HealthReport;
import org.n3x.universe.health.HealthVerifier;
import org.n3x.universe.logging.LogSections;
import org.n3x.universe.network.NetworkApplyException;
import org.n3x.universe.network.NetworkConfigurator;
import org.n3x.universe.network.TopologyStrategies;
import org.n3x.universe.network.TopologyStrategy;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeException;
import org.n3x.universe.node.NodeState;
import org.n3x.universe.topology.BondSpec;
import org.n3x.universe.topology.TopologyProfile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validation run on a fleet of VMs: validate, boot, configure the network, form the cluster,
 * verify health, run the post-formation actions, then tear everything down.
 */
@Slf4j
public class N3xUniverse extends AbstractUniverse {

    @NonNull
    private final FleetManager fleet;

    private volatile FormationContext context;

    @Builder
    public N3xUniverse(@NonNull UniverseParams universeParams, @NonNull FleetManager fleet) {
        super(universeParams);
        this.fleet = fleet;
    }

    @Override
    public RunReport run() {
        TopologyProfile profile = universeParams.getProfile();
        LogSections.banner(log, String.format("Run %s: %s topology, %d nodes",
                universeParams.getRunId(), profile.getKind(), universeParams.getNodes().size()));

        // nothing is booted before the configuration is known to be good
        TopologyStrategy strategy = validate();

        context = new FormationContext(
                profile, universeParams.getNodes(), universeParams.getFormationParams().getGlobalTimeout()
        );

        DiagnosticsCollector diagnostics = DiagnosticsCollector.builder()
                .fleet(fleet)
                .probes(DiagnosticProbes.standard(
                        universeParams.getServiceParams().units(), universeParams.getServiceParams().envFiles()
                ))
                .loggingParams(universeParams.getLoggingParams())
                .build();

        NetworkConfigurator configurator = NetworkConfigurator.builder()
                .fleet(fleet)
                .strategy(strategy)
                .diagnostics(diagnostics)
                .build();

        ClusterFormationDriver driver = ClusterFormationDriver.builder()
                .fleet(fleet)
                .configurator(configurator)
                .diagnostics(diagnostics)
                .serviceParams(universeParams.getServiceParams())
                .formationParams(universeParams.getFormationParams())
                .build();

        RunReport.RunReportBuilder report = RunReport.builder()
                .runId(universeParams.getRunId())
                .topology(profile.getKind().toString());

        try {
            fleet.setUp();
            registerShutdownHook();

            LogSections.section(log, "Cluster formation");
            driver.form(context);

            LogSections.section(log, "Health verification");
            HealthVerifier verifier = HealthVerifier.builder().fleet(fleet).profile(profile).build();
            try {
                report.health(verifier.verifyOrThrow(context.getNodes()));
            } catch (HealthCheckException ex) {
                report.health(ex.getReport());
                collectFor(diagnostics, ex.getReport());
                throw ex;
            }

            runBondFailover(profile);
            runTestScript();

            report.verdict(RunReport.Verdict.PASSED);
        } catch (NetworkApplyException | FormationTimeoutException | HealthCheckException ex) {
            report.verdict(RunReport.Verdict.FAILED).error(ex.getMessage());
        } catch (UniverseException | NodeException ex) {
            log.error("Run failed", ex);
            report.verdict(RunReport.Verdict.FAILED).error(ex.getMessage());
        } finally {
            report.phases(context.getTimeline().getRecords());
            report.diagnostics(context.getDiagnostics());
            report.nodeStates(nodeStates());
            shutdown();
        }

        RunReport result = report.build();
        LogSections.section(log, "Summary");
        log.info("\n{}", result.render());
        return result;
    }

    /**
     * @throws ConfigurationException if the profile, node set or test script are inconsistent
     */
    private TopologyStrategy validate() {
        TopologyProfile profile = universeParams.getProfile();
        profile.validateFor(universeParams.getNodes());
        TopologyStrategy strategy = TopologyStrategies.forProfile(profile);

        TestScriptTask.validate(universeParams.getTestScript(),
                name -> universeParams.getNodes().stream().anyMatch(node -> node.getName().equals(name)));

        if (universeParams.failBondMember().isPresent() && !profile.bondSpec().isPresent()) {
            throw new ConfigurationException("Bond failover requires a bonded topology, got: " + profile.getKind());
        }
        return strategy;
    }

    private void runBondFailover(TopologyProfile profile) {
        Optional<String> member = universeParams.failBondMember();
        if (!member.isPresent()) {
            return;
        }

        LogSections.section(log, "Bond failover");
        BondSpec bond = profile.bondSpec()
                .orElseThrow(() -> new ConfigurationException("No bond in " + profile.getKind() + " topology"));

        FailoverResult result = BondMemberDownFault.builder()
                .fleet(fleet)
                .node(context.primaryNode())
                .primary(context.primaryNode())
                .bond(bond)
                .member(member.get())
                .expectedReadyNodes(universeParams.getNodes().size())
                .serviceParams(universeParams.getServiceParams())
                .build()
                .execute();

        if (!result.isSuccess()) {
            throw new ActionException("Cluster did not survive bond failover: " + result);
        }
    }

    private void runTestScript() {
        if (universeParams.getTestScript().isEmpty()) {
            return;
        }

        LogSections.section(log, "Test script");
        Map<String, Node> nodes = new LinkedHashMap<>();
        context.getNodes().forEach(node -> nodes.put(node.getName(), node));

        ScriptResult result = TestScriptTask.builder()
                .fleet(fleet)
                .nodes(nodes)
                .lines(universeParams.getTestScript())
                .build()
                .execute();

        if (!result.isSuccess()) {
            throw new ActionException("Test script failed: " + result.getFailures());
        }
    }

    private void collectFor(DiagnosticsCollector diagnostics, HealthReport report) {
        report.failures().stream()
                .map(HealthReport.CheckResult::getNode)
                .distinct()
                .forEach(name -> context.node(name).ifPresent(node -> context.addDiagnostics(diagnostics.collect(
                        node, context.transcript(name).orElse(null), "health checks failed on " + name
                ))));
    }

    private ImmutableMap<String, NodeState> nodeStates() {
        ImmutableMap.Builder<String, NodeState> states = ImmutableMap.builder();
        context.getNodes().forEach(node -> states.put(node.getName(), node.getState()));
        return states.build();
    }

    @Override
    protected void shutdownNodes() {
        FormationContext current = context;
        if (current == null || current.getNodes().isEmpty()) {
            log.warn("Empty universe, nothing to shutdown");
        } else {
            for (Node node : current.getNodes()) {
                try {
                    fleet.destroy(node);
                } catch (NodeException ex) {
                    log.warn("Can't destroy node: {}. Error: {}", node.getName(), ex.getMessage());
                }
            }
        }

        try {
            fleet.tearDown();
        } catch (NodeException ex) {
            log.warn("Can't tear down the fleet: {}", ex.getMessage());
        }
    }
}
