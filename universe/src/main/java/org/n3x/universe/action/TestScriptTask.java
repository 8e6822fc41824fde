package org.n3x.universe.action;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetException;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.fleet.ShellCommand;
import org.n3x.universe.node.Node;
import org.n3x.universe.universe.ConfigurationException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Runs a post-formation test script. Each line is {@code <node> <shell command>}, blank lines and
 * lines starting with {@code #} are ignored. Every command runs even if an earlier one failed.
 */
@Slf4j
@Builder
public class TestScriptTask implements Action.Task<TestScriptTask.ScriptResult> {

    @NonNull
    private final FleetManager fleet;

    @NonNull
    private final Map<String, Node> nodes;

    @Singular
    private final ImmutableList<ScriptLine> lines;

    public static ImmutableList<ScriptLine> parse(String script) {
        ImmutableList.Builder<ScriptLine> lines = ImmutableList.builder();
        int number = 0;
        for (String line : Splitter.on('\n').trimResults().split(script)) {
            number++;
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            List<String> parts = Splitter.onPattern("\\s+").limit(2).splitToList(line);
            if (parts.size() < 2) {
                throw new ConfigurationException(String.format(
                        "Test script line %d must be `<node> <command>`: %s", number, line
                ));
            }
            lines.add(new ScriptLine(number, parts.get(0), parts.get(1)));
        }
        return lines.build();
    }

    public static ImmutableList<ScriptLine> load(File script) {
        try {
            return parse(FileUtils.readFileToString(script, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Can't read test script: " + script, e);
        }
    }

    /**
     * Checks every line targets a known node
     */
    public static void validate(List<ScriptLine> lines, Predicate<String> knownNode) {
        for (ScriptLine line : lines) {
            if (!knownNode.test(line.getNode())) {
                throw new ConfigurationException(String.format(
                        "Test script line %d targets an unknown node: %s", line.getNumber(), line.getNode()
                ));
            }
        }
    }

    @Override
    public ScriptResult execute() {
        ScriptResult.ScriptResultBuilder result = ScriptResult.builder();

        for (ScriptLine line : lines) {
            Node node = nodes.get(line.getNode());
            if (node == null) {
                result.failure(line.render() + ": unknown node");
                continue;
            }

            log.info("Test script line {} on {}: {}", line.getNumber(), line.getNode(), line.getCommand());
            try {
                ExecResult exec = fleet.exec(node, ShellCommand.shell(line.getCommand()));
                if (!exec.isSuccess()) {
                    result.failure(String.format("%s: exit %d: %s",
                            line.render(), exec.getExitCode(), exec.getOutput().trim()));
                }
            } catch (FleetException ex) {
                result.failure(line.render() + ": " + ex.getMessage());
            }
            result.executedLine(line);
        }

        ScriptResult scriptResult = result.build();
        scriptResult.getFailures().forEach(failure -> log.error("Test script failure: {}", failure));
        return scriptResult;
    }

    @AllArgsConstructor
    @Getter
    @ToString
    @EqualsAndHashCode
    public static class ScriptLine {
        private final int number;
        private final String node;
        private final String command;

        public String render() {
            return String.format("line %d [%s] %s", number, node, command);
        }
    }

    @Builder
    @Getter
    @ToString
    @EqualsAndHashCode
    public static class ScriptResult {
        @Singular
        private final ImmutableList<ScriptLine> executedLines;

        @Singular
        private final ImmutableList<String> failures;

        public boolean isSuccess() {
            return failures.isEmpty();
        }
    }
}
