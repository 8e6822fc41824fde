package org.n3x.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import com.spotify.docker.client.DefaultDockerClient;
import com.spotify.docker.client.DockerClient;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.fleet.DockerFleetManager;
import org.n3x.universe.fleet.DockerFleetManager.FleetNetworks;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.RetryingFleetManager;
import org.n3x.universe.logging.LoggingParams;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.universe.N3xUniverse;
import org.n3x.universe.universe.RunReport;
import org.n3x.universe.universe.UniverseParams;
import org.n3x.util.retry.BackoffRetry;

import java.nio.file.Paths;
import java.util.Objects;

@Slf4j
@Parameters(commandDescription = "Boot the fleet, form the cluster and verify it")
public class RunCommand extends UniverseArgs {
    private static final int DATA_LINKS = 2;

    @Parameter(names = "--log-dir", description = "Directory for diagnostics bundles and the run report.")
    private String logDir;

    @Parameter(names = "--fail-bond-member", description = "Bond member to take down on the primary after formation.")
    private String failBondMember;

    @Parameter(names = "--no-cleanup", description = "Keep the VMs after the run.")
    private boolean noCleanup = false;

    @Override
    public int run() throws Exception {
        ImmutableList<NodeSpec> nodeSpecs = nodeSpecs();
        TopologyProfile profile = profile(nodeSpecs);

        UniverseParams.UniverseParamsBuilder params = UniverseParams.universeBuilder()
                .profile(profile)
                .nodes(nodeSpecs)
                .formationParams(formationParams())
                .testScript(testScript())
                .failBondMember(failBondMember)
                .cleanUpEnabled(!noCleanup);

        UniverseParams draft = params.build();
        if (Objects.nonNull(logDir)) {
            params.loggingParams(LoggingParams.builder()
                    .testName(draft.getRunId())
                    .baseDir(Paths.get(logDir))
                    .enabled(true)
                    .build());
        }
        UniverseParams universeParams = params.runId(draft.getRunId()).build();

        DockerClient docker = DefaultDockerClient.fromEnv().build();
        try {
            FleetManager fleet = new RetryingFleetManager(
                    DockerFleetManager.builder()
                            .docker(docker)
                            .networks(FleetNetworks.forRun(universeParams.getRunId(), DATA_LINKS))
                            .build(),
                    BackoffRetry.builder().build()
            );

            RunReport report = N3xUniverse.builder()
                    .universeParams(universeParams)
                    .fleet(fleet)
                    .build()
                    .run();

            if (universeParams.getLoggingParams().isEnabled()) {
                ReportWriter.write(report, universeParams.getLoggingParams());
            }

            System.out.println(report.render());
            return report.exitCode();
        } finally {
            docker.close();
        }
    }
}
