package org.n3x.universe.formation;

import lombok.Getter;

/**
 * Ends a phase early, turned into a failed {@link PhaseResult} by {@link AbstractPhase}
 */
class PhaseFailure extends RuntimeException {

    @Getter
    private final String nodeName;

    PhaseFailure(String nodeName, String message) {
        super(message);
        this.nodeName = nodeName;
    }

    PhaseFailure(String nodeName, String message, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }
}
