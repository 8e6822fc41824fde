package org.n3x.universe.universe;

/**
 * A static configuration problem: a bad topology profile or node set.
 * Always raised before any VM is booted.
 */
public class ConfigurationException extends UniverseException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
