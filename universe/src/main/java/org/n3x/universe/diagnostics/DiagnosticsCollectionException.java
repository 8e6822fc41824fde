package org.n3x.universe.diagnostics;

import org.n3x.universe.universe.UniverseException;

/**
 * A diagnostics probe failed. Recorded in the bundle, never thrown out of the collector.
 */
public class DiagnosticsCollectionException extends UniverseException {

    public DiagnosticsCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
