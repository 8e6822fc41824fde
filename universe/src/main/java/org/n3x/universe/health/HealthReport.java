package org.n3x.universe.health;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import static org.n3x.universe.health.HealthReport.CheckStatus.FAIL;
import static org.n3x.universe.health.HealthReport.CheckStatus.WARN;

/**
 * HealthReport represents the outcome of every post-formation check of a run.
 */
@Builder
@ToString
@EqualsAndHashCode
public class HealthReport {

    /**
     * Overall status msgs
     */
    public static final String OVERALL_STATUS_UP = "Topology matches the profile";
    public static final String OVERALL_STATUS_DOWN = "Some of the checks failed";

    @NonNull
    @Getter
    @Singular
    private final ImmutableList<CheckResult> checks;

    public boolean isHealthy() {
        return checks.stream().noneMatch(check -> check.status == FAIL);
    }

    public ImmutableList<CheckResult> failures() {
        return filter(FAIL);
    }

    public ImmutableList<CheckResult> warnings() {
        return filter(WARN);
    }

    public String getReason() {
        return isHealthy() ? OVERALL_STATUS_UP : OVERALL_STATUS_DOWN;
    }

    private ImmutableList<CheckResult> filter(CheckStatus status) {
        return checks.stream()
                .filter(check -> check.status == status)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * @return A json representation of a health report
     */
    public String asJson() {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        return gson.toJson(this);
    }

    public enum CheckStatus {

        @SerializedName("PASS")
        PASS,

        /**
         * Soft check failed, reported but never fails the run
         */
        @SerializedName("WARN")
        WARN,

        @SerializedName("FAIL")
        FAIL
    }

    @AllArgsConstructor(staticName = "of")
    @ToString
    @EqualsAndHashCode
    @Getter
    public static class CheckResult {
        private final String node;

        private final String check;

        private final CheckStatus status;

        private final String detail;

        public String render() {
            return String.format("[%s] %s %s: %s", status, node, check, detail);
        }
    }
}
