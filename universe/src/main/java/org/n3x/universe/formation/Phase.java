package org.n3x.universe.formation;

/**
 * A step of the formation pipeline
 */
public interface Phase {

    String name();

    /**
     * Run the phase. A phase reports a timeout or a failed node through the result, it doesn't throw.
     */
    PhaseResult run(FormationContext context);
}
