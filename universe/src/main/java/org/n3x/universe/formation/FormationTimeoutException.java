package org.n3x.universe.formation;

import lombok.Getter;
import org.n3x.universe.diagnostics.DiagnosticsBundle;
import org.n3x.universe.universe.UniverseException;

/**
 * A node never reached the expected state of a formation phase
 */
public class FormationTimeoutException extends UniverseException {

    @Getter
    private final String phase;

    @Getter
    private final String nodeName;

    @Getter
    private final transient DiagnosticsBundle diagnostics;

    public FormationTimeoutException(String phase, String nodeName, String message, DiagnosticsBundle diagnostics) {
        super(message);
        this.phase = phase;
        this.nodeName = nodeName;
        this.diagnostics = diagnostics;
    }
}
