package org.n3x.universe.fleet;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered record of the commands run on a node, with their results.
 */
public class CommandTranscript {

    @Getter
    private final String nodeName;

    private final List<Entry> entries = new ArrayList<>();

    public CommandTranscript(@NonNull String nodeName) {
        this.nodeName = nodeName;
    }

    public synchronized void executed(ShellCommand command, ExecResult result) {
        entries.add(new Entry(command, result, false, Instant.now()));
    }

    public synchronized void skipped(ShellCommand command) {
        entries.add(new Entry(command, null, true, Instant.now()));
    }

    public synchronized ImmutableList<Entry> getEntries() {
        return ImmutableList.copyOf(entries);
    }

    /**
     * Commands that actually ran, skipped ones excluded
     */
    public synchronized ImmutableList<ShellCommand> executedCommands() {
        return entries.stream()
                .filter(entry -> !entry.isSkipped())
                .map(Entry::getCommand)
                .collect(ImmutableList.toImmutableList());
    }

    public synchronized String render() {
        StringBuilder out = new StringBuilder();
        for (Entry entry : entries) {
            out.append(entry.render()).append('\n');
        }
        return out.toString();
    }

    @AllArgsConstructor
    @Getter
    @ToString
    public static class Entry {
        private final ShellCommand command;
        private final ExecResult result;
        private final boolean skipped;
        private final Instant timestamp;

        public Optional<ExecResult> result() {
            return Optional.ofNullable(result);
        }

        String render() {
            if (skipped) {
                return "[skip] $ " + command.render();
            }
            String line = String.format("[exit %d] $ %s", result.getExitCode(), command.render());
            String output = result.getOutput().trim();
            return output.isEmpty() ? line : line + "\n    " + output.replace("\n", "\n    ");
        }
    }
}
