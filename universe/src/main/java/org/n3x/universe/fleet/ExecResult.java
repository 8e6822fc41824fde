package org.n3x.universe.fleet;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@AllArgsConstructor
@Getter
@EqualsAndHashCode
@ToString
public class ExecResult {
    private final int exitCode;

    @NonNull
    private final String output;

    public static ExecResult ok(String output) {
        return new ExecResult(0, output);
    }

    public static ExecResult failed(int exitCode, String output) {
        return new ExecResult(exitCode, output);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
