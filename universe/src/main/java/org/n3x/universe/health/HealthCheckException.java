package org.n3x.universe.health;

import lombok.Getter;
import org.n3x.universe.universe.UniverseException;

import java.util.stream.Collectors;

/**
 * One or more hard post-formation checks failed. Raised after every check ran.
 */
public class HealthCheckException extends UniverseException {

    @Getter
    private final transient HealthReport report;

    public HealthCheckException(HealthReport report) {
        super("Health checks failed:\n" + report.failures().stream()
                .map(HealthReport.CheckResult::render)
                .collect(Collectors.joining("\n")));
        this.report = report;
    }
}
