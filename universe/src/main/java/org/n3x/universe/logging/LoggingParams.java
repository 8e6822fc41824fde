package org.n3x.universe.logging;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Specifies where diagnostics bundles and the run summary are written
 */
@Builder
public class LoggingParams {

    @NonNull
    private final String testName;

    @Default
    @NonNull
    private final Path baseDir = Paths.get("build", "logs");

    @Default
    @Getter
    private final boolean enabled = false;

    public Path getRunLogDir() {
        return baseDir.resolve(testName);
    }
}
