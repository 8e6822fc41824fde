package org.n3x.universe.topology;

import org.n3x.universe.universe.ConfigurationException;

public class InvalidBondSpecException extends ConfigurationException {
    public InvalidBondSpecException(String message) {
        super(message);
    }
}
