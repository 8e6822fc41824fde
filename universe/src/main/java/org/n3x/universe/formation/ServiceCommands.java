package org.n3x.universe.formation;

import com.google.common.collect.ImmutableList;
import org.n3x.universe.fleet.ShellCommand;

/**
 * Commands driving the clustered service on a node
 */
public class ServiceCommands {

    private ServiceCommands() {
        //prevent creating class util instances
    }

    /**
     * Write a file. The content travels as a positional parameter, so it needs no quoting.
     */
    public static ShellCommand writeFile(String path, String content) {
        return ShellCommand.of("sh", "-c", "printf '%s' \"$1\" > " + path, "sh", content);
    }

    public static ShellCommand readFile(String path) {
        return ShellCommand.of("cat", path);
    }

    /**
     * Succeeds once the file exists and is not empty
     */
    public static ShellCommand fileNotEmpty(String path) {
        return ShellCommand.of("test", "-s", path);
    }

    public static ShellCommand daemonReload() {
        return ShellCommand.of("systemctl", "daemon-reload");
    }

    public static ShellCommand start(String unit) {
        return ShellCommand.of("systemctl", "start", unit);
    }

    public static ShellCommand isActive(String unit) {
        return ShellCommand.of("systemctl", "is-active", unit);
    }

    public static ShellCommand readyz(ImmutableList<String> kubectl) {
        return kubectl(kubectl, "get", "--raw", "/readyz");
    }

    public static ShellCommand getNodes(ImmutableList<String> kubectl) {
        return kubectl(kubectl, "get", "nodes", "--no-headers");
    }

    private static ShellCommand kubectl(ImmutableList<String> kubectl, String... args) {
        return ShellCommand.of(ImmutableList.<String>builder()
                .addAll(kubectl)
                .add(args)
                .build()
                .toArray(new String[0]));
    }
}
