package org.n3x.cli;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.n3x.universe.logging.LoggingParams;
import org.n3x.universe.universe.RunReport;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes the run report next to the diagnostics bundles
 */
@Slf4j
public class ReportWriter {

    private ReportWriter() {
        //prevent creating instances
    }

    public static void write(RunReport report, LoggingParams loggingParams) {
        File dir = loggingParams.getRunLogDir().toFile();
        try {
            FileUtils.forceMkdir(dir);
            FileUtils.writeStringToFile(new File(dir, "report.txt"), report.render(), StandardCharsets.UTF_8);
            FileUtils.writeStringToFile(new File(dir, "report.json"), report.asJson(), StandardCharsets.UTF_8);
            log.info("Run report written to {}", dir);
        } catch (IOException e) {
            log.warn("Can't write the run report to {}", dir, e);
        }
    }
}
