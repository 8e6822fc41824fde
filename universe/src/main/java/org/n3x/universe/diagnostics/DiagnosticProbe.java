package org.n3x.universe.diagnostics;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.n3x.universe.fleet.ShellCommand;

/**
 * A named command whose output goes into a diagnostics bundle
 */
@AllArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class DiagnosticProbe {
    @NonNull
    private final String name;

    @NonNull
    private final ShellCommand command;
}
