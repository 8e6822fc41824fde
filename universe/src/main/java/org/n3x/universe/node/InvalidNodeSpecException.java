package org.n3x.universe.node;

import org.n3x.universe.universe.ConfigurationException;

/**
 * The node set is inconsistent: no primary, several primaries, a primary agent or duplicate names.
 */
public class InvalidNodeSpecException extends ConfigurationException {

    public InvalidNodeSpecException(String message) {
        super(message);
    }
}
