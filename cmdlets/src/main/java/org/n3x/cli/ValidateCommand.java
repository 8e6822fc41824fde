package org.n3x.cli;

import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import org.n3x.universe.action.TestScriptTask;
import org.n3x.universe.network.NetworkCommand;
import org.n3x.universe.network.NetworkConfigurator;
import org.n3x.universe.network.TopologyStrategies;
import org.n3x.universe.network.TopologyStrategy;
import org.n3x.universe.node.NodeSpec;
import org.n3x.universe.topology.TopologyProfile;

import java.io.PrintStream;

/**
 * Checks the topology profile, node set and test script without booting anything,
 * then prints the network plan of every node.
 */
@Parameters(commandDescription = "Validate the configuration and print the network plan")
public class ValidateCommand extends UniverseArgs {

    private final PrintStream out;

    public ValidateCommand() {
        this(System.out);
    }

    ValidateCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public int run() {
        ImmutableList<NodeSpec> nodeSpecs = nodeSpecs();
        TopologyProfile profile = profile(nodeSpecs);
        profile.validateFor(nodeSpecs);
        TopologyStrategy strategy = TopologyStrategies.forProfile(profile);

        TestScriptTask.validate(testScript(),
                name -> nodeSpecs.stream().anyMatch(spec -> spec.getName().equals(name)));

        out.printf("Topology %s is valid for %d nodes%n", profile.getKind(), nodeSpecs.size());
        for (NodeSpec node : nodeSpecs) {
            out.printf("%s (%s%s)%n", node.getName(), node.getRole(), node.isPrimary() ? ", primary" : "");
            for (NetworkCommand step : NetworkConfigurator.plan(strategy, node)) {
                out.printf("  %-40s %s%n", step.getDescription(), step.getCommand().render());
            }
        }
        return 0;
    }
}
