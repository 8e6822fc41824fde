package org.n3x.universe.formation;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase by phase record of a run
 */
@Slf4j
public class PhaseTimeline {

    private final List<PhaseRecord> records = new ArrayList<>();

    public synchronized void record(PhaseResult result) {
        PhaseStatus status = result.isSuccess() ? PhaseStatus.PASSED : PhaseStatus.FAILED;
        PhaseRecord record = new PhaseRecord(
                result.getPhase(), status, result.getElapsed().toMillis(), result.getDetail()
        );
        records.add(record);

        if (result.isSuccess()) {
            log.info("Phase {} passed in {} ms: {}", record.phase, record.elapsedMs, record.detail);
        } else {
            log.error("Phase {} failed after {} ms: {}", record.phase, record.elapsedMs, record.detail);
        }
    }

    public synchronized void skipped(String phase) {
        records.add(new PhaseRecord(phase, PhaseStatus.SKIPPED, 0, "aborted"));
    }

    public synchronized ImmutableList<PhaseRecord> getRecords() {
        return ImmutableList.copyOf(records);
    }

    public synchronized String render() {
        StringBuilder out = new StringBuilder();
        String rule = Strings.repeat("-", 60);
        out.append(rule).append('\n');
        for (PhaseRecord record : records) {
            out.append(String.format("%-18s %-8s %8d ms  %s%n",
                    record.phase, record.status, record.elapsedMs, record.detail));
        }
        out.append(rule);
        return out.toString();
    }

    @AllArgsConstructor
    @Getter
    @ToString
    @EqualsAndHashCode
    public static class PhaseRecord {
        private final String phase;
        private final PhaseStatus status;
        private final long elapsedMs;
        private final String detail;
    }

    public enum PhaseStatus {
        @SerializedName("PASSED")
        PASSED,

        @SerializedName("FAILED")
        FAILED,

        @SerializedName("SKIPPED")
        SKIPPED
    }
}
