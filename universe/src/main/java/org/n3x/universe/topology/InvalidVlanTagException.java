package org.n3x.universe.topology;

import org.n3x.universe.universe.ConfigurationException;

public class InvalidVlanTagException extends ConfigurationException {
    public InvalidVlanTagException(String message) {
        super(message);
    }
}
