package org.n3x.universe.topology;

import org.n3x.universe.universe.ConfigurationException;

/**
 * A node has no address (or a segment has no interface) for a segment its topology requires.
 */
public class MissingAddressException extends ConfigurationException {
    public MissingAddressException(String message) {
        super(message);
    }
}
