package org.n3x.universe.fleet;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * A command executed on a node through the fleet's out-of-band exec channel.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ShellCommand {

    @NonNull
    private final ImmutableList<String> argv;

    /**
     * A nonzero exit of a tolerated command is logged and ignored.
     */
    private final boolean tolerated;

    public static ShellCommand of(String... argv) {
        if (argv.length == 0) {
            throw new IllegalArgumentException("Empty command");
        }
        return new ShellCommand(ImmutableList.copyOf(argv), false);
    }

    /**
     * A shell snippet, for commands that need pipes or redirections
     */
    public static ShellCommand shell(String script) {
        return of("sh", "-c", script);
    }

    public ShellCommand tolerated() {
        return new ShellCommand(argv, true);
    }

    public String[] toArray() {
        return argv.toArray(new String[0]);
    }

    public String render() {
        return Joiner.on(' ').join(argv);
    }

    @Override
    public String toString() {
        return render();
    }
}
