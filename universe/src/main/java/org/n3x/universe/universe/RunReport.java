package org.n3x.universe.universe;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.formation.PhaseTimeline.PhaseRecord;
import org.n3x.universe.health.HealthReport;
import org.n3x.universe.node.NodeState;

import java.util.Map;
import java.util.Optional;

/**
 * User visible result of a run: verdict, phase timeline, final node states and, on failure, diagnostics.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class RunReport {
    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;

    @NonNull
    private final String runId;

    @NonNull
    private final String topology;

    @NonNull
    private final Verdict verdict;

    @Singular
    private final ImmutableList<PhaseRecord> phases;

    @Singular
    private final Map<String, NodeState> nodeStates;

    private final HealthReport health;

    @Singular
    private final ImmutableList<DiagnosticsBundle> diagnostics;

    /**
     * Message of the error that failed the run
     */
    private final String error;

    public boolean isPassed() {
        return verdict == Verdict.PASSED;
    }

    public int exitCode() {
        return isPassed() ? EXIT_PASSED : EXIT_FAILED;
    }

    public Optional<HealthReport> health() {
        return Optional.ofNullable(health);
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(String.format("Run %s (%s): %s%n", runId, topology, verdict));
        phases.forEach(phase -> out.append(String.format("  %-18s %-8s %8d ms  %s%n",
                phase.getPhase(), phase.getStatus(), phase.getElapsedMs(), phase.getDetail())));
        nodeStates.forEach((node, state) -> out.append(String.format("  node %-12s %s%n", node, state)));
        if (health != null) {
            out.append(String.format("  health: %s, %d warnings%n", health.getReason(), health.warnings().size()));
        }
        if (error != null) {
            out.append("  error: ").append(error).append('\n');
        }
        return out.toString();
    }

    /**
     * @return A json representation of the run report
     */
    public String asJson() {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(this);
    }

    public enum Verdict {
        @SerializedName("PASSED")
        PASSED,

        @SerializedName("FAILED")
        FAILED
    }
}
