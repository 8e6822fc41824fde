package org.n3x.universe.scenario.fixture;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import org.n3x.universe.action.TestScriptTask.ScriptLine;
import org.n3x.universe.diagnostics.DiagnosticProbes;
import org.n3x.universe.diagnostics.DiagnosticsCollector;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.SimulatedFleet;
import org.n3x.universe.formation.ClusterFormationDriver;
import org.n3x.universe.formation.FormationContext;
import org.n3x.universe.formation.FormationParams;
import org.n3x.universe.formation.ServiceParams;
import org.n3x.universe.network.NetworkConfigurator;
import org.n3x.universe.network.TopologyStrategies;
import org.n3x.universe.node.NodeRole;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.topology.TopologyProfiles;
import org.n3x.universe.universe.UniverseParams;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

public interface Fixtures {

    /**
     * Two servers and one agent
     */
    static ImmutableList<NodeSpec> threeNodes() {
        return ImmutableList.of(
                NodeSpec.builder().name("server-1").role(NodeRole.SERVER).primary(true).build(),
                NodeSpec.builder().name("server-2").role(NodeRole.SERVER).build(),
                NodeSpec.builder().name("agent-1").role(NodeRole.AGENT).build()
        );
    }

    /**
     * Timeouts short enough for the simulated fleet
     */
    static FormationParams fastFormation(Duration timeout) {
        return FormationParams.builder()
                .bootTimeout(timeout)
                .apiPortTimeout(timeout)
                .readyzTimeout(timeout)
                .primaryReadyTimeout(timeout)
                .tokenTimeout(timeout)
                .joinTimeout(timeout)
                .clusterReadyTimeout(timeout)
                .globalTimeout(Duration.ofMinutes(1))
                .build();
    }

    static DiagnosticsCollector diagnostics(FleetManager fleet) {
        ServiceParams service = ServiceParams.defaults();
        return DiagnosticsCollector.builder()
                .fleet(fleet)
                .probes(DiagnosticProbes.standard(service.units(), service.envFiles()))
                .build();
    }

    static NetworkConfigurator configurator(FleetManager fleet, TopologyProfile profile) {
        return NetworkConfigurator.builder()
                .fleet(fleet)
                .strategy(TopologyStrategies.forProfile(profile))
                .diagnostics(diagnostics(fleet))
                .build();
    }

    static ClusterFormationDriver driver(FleetManager fleet, TopologyProfile profile, Duration timeout) {
        return ClusterFormationDriver.builder()
                .fleet(fleet)
                .configurator(configurator(fleet, profile))
                .diagnostics(diagnostics(fleet))
                .formationParams(fastFormation(timeout))
                .build();
    }

    @Builder
    @Getter
    class UniverseFixture implements Fixture<UniverseParams> {

        @Default
        @NonNull
        private final TopologyKind kind = TopologyKind.FLAT;

        @Default
        @NonNull
        private final ImmutableList<NodeSpec> nodes = threeNodes();

        @Default
        @NonNull
        private final Duration timeout = Duration.ofSeconds(2);

        @Default
        @NonNull
        private final ImmutableList<ScriptLine> testScript = ImmutableList.of();

        private final String failBondMember;

        @Override
        public UniverseParams data() {
            return UniverseParams.universeBuilder()
                    .runId("test-" + kind)
                    .profile(TopologyProfiles.forKind(kind, nodes))
                    .nodes(nodes)
                    .formationParams(fastFormation(timeout))
                    .testScript(testScript)
                    .failBondMember(failBondMember)
                    .build();
        }
    }

    /**
     * A cluster formed on a simulated fleet
     */
    @Builder
    @Getter
    class FormedClusterFixture implements Fixture<FormationContext> {

        @Default
        @NonNull
        private final TopologyKind kind = TopologyKind.BONDED_VLAN;

        @Default
        @NonNull
        private final ImmutableList<NodeSpec> nodes = threeNodes();

        @Default
        @NonNull
        private final SimulatedFleet fleet = new SimulatedFleet();

        private final AtomicReference<FormationContext> formed = new AtomicReference<>();

        /**
         * Forms the cluster on the first call
         */
        @Override
        public synchronized FormationContext data() {
            if (formed.get() == null) {
                TopologyProfile profile = TopologyProfiles.forKind(kind, nodes);
                FormationContext context = new FormationContext(profile, nodes, Duration.ofMinutes(1));
                driver(fleet, profile, Duration.ofSeconds(2)).form(context);
                formed.set(context);
            }
            return formed.get();
        }
    }
}
