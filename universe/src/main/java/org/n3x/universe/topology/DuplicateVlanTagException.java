package org.n3x.universe.topology;

import org.n3x.universe.universe.ConfigurationException;

public class DuplicateVlanTagException extends ConfigurationException {
    public DuplicateVlanTagException(String message) {
        super(message);
    }
}
