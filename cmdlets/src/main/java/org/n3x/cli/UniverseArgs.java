package org.n3x.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.n3x.universe.action.TestScriptTask;
import org.n3x.universe.action.TestScriptTask.ScriptLine;
import org.n3x.universe.formation.FormationParams;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.node.NodeSpecs;
import org.n3x.universe.topology.TopologyKind;
import org.n3x.universe.topology.TopologyProfile;
import org.n3x.universe.topology.TopologyProfileLoader;
import org.n3x.universe.topology.TopologyProfiles;

import java.io.File;
import java.time.Duration;
import java.util.Objects;

/**
 * Options describing the cluster under test: topology, nodes and what runs after formation.
 */
@Slf4j
public abstract class UniverseArgs extends BaseCommand {

    @Parameter(names = "--topology", description = "Network topology: flat, vlan or bonded-vlan.")
    String topology = TopologyKind.FLAT.toString();

    @Parameter(names = "--nodes", description = "Node role map, e.g. server-1=server:primary,server-2=server,agent-1=agent")
    String nodes;

    @Parameter(names = "--profile-file", description = "Path to a json topology profile, overrides --topology.")
    String profileFile;

    @Parameter(names = "--test-script", description = "Path to a post-formation test script.")
    String testScript;

    @Parameter(names = "--timeout", description = "Global timeout of the run in minutes.")
    int timeoutMinutes = 60;

    @Parameter(names = "--image", description = "VM image of every node.")
    String image = NodeSpec.DEFAULT_IMAGE;

    protected ImmutableList<NodeSpec> nodeSpecs() {
        if (Objects.isNull(nodes)) {
            return ImmutableList.copyOf(TopologyProfiles.defaultNodes().stream()
                    .map(spec -> spec.toBuilder().image(image).build())
                    .iterator());
        }
        return NodeSpecs.validate(NodeMapParser.parse(nodes, image));
    }

    protected TopologyProfile profile(ImmutableList<NodeSpec> nodeSpecs) {
        if (Objects.isNull(profileFile)) {
            return TopologyProfiles.forKind(TopologyKind.fromName(topology), nodeSpecs);
        }

        TopologyProfile profile = new TopologyProfileLoader().load(new File(profileFile));
        log.info("Topology profile {} loaded from {}", profile.getKind(), profileFile);
        return profile;
    }

    protected ImmutableList<ScriptLine> testScript() {
        if (Objects.isNull(testScript)) {
            return ImmutableList.of();
        }
        return TestScriptTask.load(new File(testScript));
    }

    protected FormationParams formationParams() {
        if (timeoutMinutes <= 0) {
            throw new ParameterException("--timeout must be positive: " + timeoutMinutes);
        }
        return FormationParams.builder()
                .globalTimeout(Duration.ofMinutes(timeoutMinutes))
                .build();
    }
}
