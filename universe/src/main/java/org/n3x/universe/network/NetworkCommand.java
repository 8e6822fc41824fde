package org.n3x.universe.network;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.ShellCommand;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * One step of a network plan. A step with a guard is skipped when the guard probe result matches,
 * which makes creation steps safe to re-run.
 */
@Builder
@ToString(of = {"description", "command"})
public class NetworkCommand {

    @Getter
    @NonNull
    private final String description;

    @Getter
    @NonNull
    private final ShellCommand command;

    private final ShellCommand guard;

    private final Predicate<ExecResult> skipWhen;

    public static NetworkCommand of(String description, ShellCommand command) {
        return NetworkCommand.builder().description(description).command(command).build();
    }

    /**
     * Skip the step if the device already exists
     */
    public static NetworkCommand unlessExists(String description, String device, ShellCommand command) {
        return NetworkCommand.builder()
                .description(description)
                .command(command)
                .guard(IpCommands.linkShow(device))
                .skipWhen(ExecResult::isSuccess)
                .build();
    }

    /**
     * Skip the step if the member is already enslaved to the bond
     */
    public static NetworkCommand unlessEnslaved(String description, String member, String bond,
                                                ShellCommand command) {
        return NetworkCommand.builder()
                .description(description)
                .command(command)
                .guard(IpCommands.linkShow(member))
                .skipWhen(result -> result.isSuccess() && result.getOutput().contains("master " + bond))
                .build();
    }

    public Optional<ShellCommand> guard() {
        return Optional.ofNullable(guard);
    }

    public boolean shouldSkip(ExecResult guardResult) {
        return skipWhen != null && skipWhen.test(guardResult);
    }
}
