package org.n3x.universe.action;

import org.n3x.universe.universe.UniverseException;

public class ActionException extends UniverseException {

    public ActionException(String message) {
        super(message);
    }

    public ActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
