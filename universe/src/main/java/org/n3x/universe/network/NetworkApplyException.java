package org.n3x.universe.network;

import lombok.Getter;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.fleet.CommandTranscript;
import org.n3x.universe.universe.UniverseException;

/**
 * A network configuration command failed on a node. Carries the transcript up to the failing command
 * and the diagnostics collected right after the failure.
 */
public class NetworkApplyException extends UniverseException {

    @Getter
    private final String nodeName;

    @Getter
    private final transient CommandTranscript transcript;

    @Getter
    private final transient DiagnosticsBundle diagnostics;

    public NetworkApplyException(String nodeName, String message, CommandTranscript transcript,
                                 DiagnosticsBundle diagnostics, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
        this.transcript = transcript;
        this.diagnostics = diagnostics;
    }
}
