package org.n3x.universe.fleet;

import org.n3x.universe.node.NodeException;

/**
 * The VM runtime could not carry out an operation: boot, exec or destroy.
 * A command that ran and exited nonzero is not a fleet failure, see {@link ExecResult}.
 */
public class FleetException extends NodeException {

    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
