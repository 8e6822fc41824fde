package org.n3x.universe.fleet;

import com.google.common.collect.ImmutableList;
import com.spotify.docker.client.DockerClient;
import com.spotify.docker.client.LogStream;
import com.spotify.docker.client.exceptions.DockerException;
import com.spotify.docker.client.messages.ContainerConfig;
import com.spotify.docker.client.messages.ContainerCreation;
import com.spotify.docker.client.messages.ContainerInfo;
import com.spotify.docker.client.messages.ExecCreation;
import com.spotify.docker.client.messages.HostConfig;
import com.spotify.docker.client.messages.NetworkConfig;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.node.Node;
import org.n3x.universe.node.NodeResources;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.VmNode;
import org.n3x.util.retry.Sleeper;

import java.time.Duration;
import java.util.List;

/**
 * Runs the fleet as privileged docker containers booting systemd.
 * <p>
 * Each container gets the management network as eth0 and one extra bridge network per data link
 * (eth1, eth2, ...), so bonds and VLAN trunks can be built inside the container.
 */
@Slf4j
public class DockerFleetManager extends AbstractFleetManager {
    private static final long CPU_PERIOD = 100_000L;

    @NonNull
    private final DockerClient docker;

    @Getter
    @NonNull
    private final FleetNetworks networks;

    @Builder
    public DockerFleetManager(@NonNull DockerClient docker, @NonNull FleetNetworks networks, Duration pollInterval) {
        super(pollInterval == null ? Duration.ofSeconds(5) : pollInterval, Sleeper.THREAD_SLEEP);
        this.docker = docker;
        this.networks = networks;
    }

    /**
     * Create the management and data link networks
     */
    @Override
    public void setUp() {
        for (String networkName : networks.all()) {
            log.info("Setup docker network: {}", networkName);

            NetworkConfig networkConfig = NetworkConfig.builder()
                    .checkDuplicate(true)
                    .attachable(true)
                    .name(networkName)
                    .build();
            try {
                docker.createNetwork(networkConfig);
            } catch (DockerException | InterruptedException e) {
                throw new FleetException("Cannot setup docker network: " + networkName, e);
            }
        }
    }

    @Override
    public void tearDown() {
        for (String networkName : networks.all()) {
            log.info("Shutdown docker network: {}", networkName);
            try {
                docker.removeNetwork(networkName);
            } catch (DockerException | InterruptedException e) {
                log.warn("Can't remove docker network: {}. Error: {}", networkName, e.getMessage());
            }
        }
    }

    @Override
    public Node boot(NodeSpec spec) {
        log.info("Booting VM container: {}, image: {}", spec.getName(), spec.getImage());

        NodeResources resources = spec.getResources();

        HostConfig hostConfig = HostConfig.builder()
                .privileged(true)
                .memory(resources.getMemoryMb() * 1024L * 1024L)
                .cpuPeriod(CPU_PERIOD)
                .cpuQuota(resources.getCores() * CPU_PERIOD)
                .networkMode(networks.getManagement())
                .build();

        ContainerConfig containerConfig = ContainerConfig.builder()
                .hostConfig(hostConfig)
                .image(spec.getImage())
                .hostname(spec.getName())
                .build();

        try {
            ContainerCreation creation = docker.createContainer(containerConfig, spec.getName());
            String containerId = creation.id();

            // connection order defines the interface names inside the container
            for (String dataLink : networks.getDataLinks()) {
                docker.connectToNetwork(containerId, docker.inspectNetwork(dataLink).id());
            }

            docker.startContainer(containerId);
            return VmNode.of(spec, containerId);
        } catch (DockerException | InterruptedException e) {
            throw new FleetException("Can't boot VM container: " + spec.getName(), e);
        }
    }

    @Override
    public ExecResult exec(Node node, ShellCommand command) {
        log.debug("Exec on {}: {}", node.getName(), command);

        try {
            ExecCreation execCreation = docker.execCreate(
                    node.getInstanceId(),
                    command.toArray(),
                    DockerClient.ExecCreateParam.attachStdout(),
                    DockerClient.ExecCreateParam.attachStderr()
            );

            final String output;
            try (LogStream stream = docker.execStart(execCreation.id())) {
                output = stream.readFully();
            }

            Number exitCode = docker.execInspect(execCreation.id()).exitCode();
            return new ExecResult(exitCode == null ? -1 : exitCode.intValue(), output);
        } catch (DockerException | InterruptedException e) {
            throw new FleetException("Can't exec on " + node.getName() + ": " + command, e);
        }
    }

    /**
     * Immediately kill and remove the container
     */
    @Override
    public void destroy(Node node) {
        String containerName = node.getName();
        log.info("Destroying VM container: {}", containerName);

        try {
            ContainerInfo container = docker.inspectContainer(node.getInstanceId());
            if (container.state().running()) {
                docker.killContainer(node.getInstanceId());
            }
            docker.removeContainer(node.getInstanceId());
        } catch (DockerException | InterruptedException ex) {
            throw new FleetException("Can't destroy VM container: " + containerName, ex);
        }
    }

    /**
     * Docker networks backing the VM links
     */
    @Builder
    @Getter
    public static class FleetNetworks {
        private static final String NETWORK_PREFIX = "n3x-";

        @NonNull
        private final String management;

        /**
         * Data links in interface order: the first one is eth1
         */
        @NonNull
        private final ImmutableList<String> dataLinks;

        public static FleetNetworks forRun(String runId, int dataLinkCount) {
            ImmutableList.Builder<String> links = ImmutableList.builder();
            for (int i = 1; i <= dataLinkCount; i++) {
                links.add(NETWORK_PREFIX + runId + "-eth" + i);
            }
            return FleetNetworks.builder()
                    .management(NETWORK_PREFIX + runId + "-mgmt")
                    .dataLinks(links.build())
                    .build();
        }

        public List<String> all() {
            return ImmutableList.<String>builder().add(management).addAll(dataLinks).build();
        }
    }
}
