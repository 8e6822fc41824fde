package org.n3x.universe.formation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@EqualsAndHashCode
@ToString
public class PhaseResult {

    @NonNull
    private final String phase;

    private final boolean success;

    @NonNull
    private final String detail;

    /**
     * Node the failure is attributed to, if any
     */
    private final String failedNode;

    @NonNull
    private final Duration elapsed;

    public static PhaseResult success(String phase, String detail, Duration elapsed) {
        return new PhaseResult(phase, true, detail, null, elapsed);
    }

    public static PhaseResult failed(String phase, String failedNode, String detail, Duration elapsed) {
        return new PhaseResult(phase, false, detail, failedNode, elapsed);
    }

    public Optional<String> failedNode() {
        return Optional.ofNullable(failedNode);
    }
}
