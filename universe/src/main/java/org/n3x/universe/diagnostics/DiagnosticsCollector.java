package org.n3x.universe.diagnostics;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.fleet.ExecResult;
import org.n3x.universe.fleet.FleetManager;
import org.n3x.universe.logging.LoggingParams;
import org.n3x.universe.node.Node;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

/**
 * Gathers a {@link DiagnosticsBundle} for a failed node.
 * <p>
 * Collection never throws: a probe that fails is noted in the bundle and the rest still run.
 * The caller keeps propagating its original error.
 */
@Slf4j
@Builder
public class DiagnosticsCollector {

    @NonNull
    private final FleetManager fleet;

    @NonNull
    private final ImmutableList<DiagnosticProbe> probes;

    /**
     * Where bundles are written, nothing is written if absent
     */
    private final LoggingParams loggingParams;

    /**
     * Collect diagnostics of a booted node.
     *
     * @param node       failed node
     * @param transcript its network configuration transcript, may be null
     * @param cause      the original error
     * @return the bundle, possibly partial
     */
    public DiagnosticsBundle collect(Node node, CommandTranscript transcript, Throwable cause) {
        return collect(node, transcript, describe(cause));
    }

    /**
     * Same as {@link #collect(Node, CommandTranscript, Throwable)} with a failure description
     */
    public DiagnosticsBundle collect(Node node, CommandTranscript transcript, String failure) {
        log.error("Collecting diagnostics of {}. Failure: {}", node.getName(), failure);

        DiagnosticsBundle.DiagnosticsBundleBuilder bundle = DiagnosticsBundle.builder()
                .nodeName(node.getName())
                .failure(failure)
                .collectedAt(Instant.now().toString());

        if (transcript != null) {
            bundle.transcript(transcript.render());
        }

        for (DiagnosticProbe probe : probes) {
            try {
                ExecResult result = fleet.exec(node, probe.getCommand());
                String output = result.getOutput();
                if (!result.isSuccess()) {
                    output = String.format("[exit %d]%n%s", result.getExitCode(), output);
                }
                bundle.section(probe.getName(), output);
            } catch (RuntimeException ex) {
                DiagnosticsCollectionException probeFailure = new DiagnosticsCollectionException(
                        "Can't collect " + probe.getName() + " on " + node.getName(), ex
                );
                log.warn(probeFailure.getMessage(), ex);
                bundle.note(probeFailure.getMessage() + ": " + describe(ex));
            }
        }

        return write(bundle.build());
    }

    /**
     * Diagnostics of a node that never booted, only the failure is known
     */
    public DiagnosticsBundle unreachable(String nodeName, String failure) {
        log.error("Node {} is unreachable, no diagnostics. Failure: {}", nodeName, failure);

        return write(DiagnosticsBundle.builder()
                .nodeName(nodeName)
                .failure(failure)
                .collectedAt(Instant.now().toString())
                .note("node unreachable: no exec channel")
                .build());
    }

    private DiagnosticsBundle write(DiagnosticsBundle bundle) {
        log.error(bundle.render());

        if (loggingParams == null || !loggingParams.isEnabled()) {
            return bundle;
        }

        File dir = loggingParams.getRunLogDir().toFile();
        File text = new File(dir, bundle.getNodeName() + "-diagnostics.txt");
        File json = new File(dir, bundle.getNodeName() + "-diagnostics.json");

        try {
            FileUtils.forceMkdir(dir);
            FileUtils.writeStringToFile(text, bundle.render(), StandardCharsets.UTF_8);
            FileUtils.writeStringToFile(json, bundle.asJson(), StandardCharsets.UTF_8);
            log.info("Diagnostics of {} written to {}", bundle.getNodeName(), text);
        } catch (IOException e) {
            log.warn("Can't write diagnostics of {} to {}", bundle.getNodeName(), dir, e);
        }

        return bundle;
    }

    private static String describe(Throwable cause) {
        return Optional.ofNullable(cause)
                .map(c -> c.getClass().getSimpleName() + ": " + c.getMessage())
                .orElse("unknown");
    }
}
