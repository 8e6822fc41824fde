package org.n3x.universe.universe;

/**
 * A Universe is one validation run: a fleet of nodes, a network topology and the cluster formed on top of them.
 * <p>
 * The following are the main functionalities provided by this class:
 * RUN: validate the configuration, boot the fleet, form the cluster and verify its health.
 * SHUTDOWN: destroy every booted node and release fleet resources.
 */
public interface Universe {

    /**
     * Run the validation.
     *
     * @return the run verdict, timeline and diagnostics
     * @throws ConfigurationException if the profile or node set is invalid, no VM is booted then
     */
    RunReport run();

    /**
     * Shutdown the entire universe by destroying every booted node.
     */
    void shutdown();

    UniverseParams getUniverseParams();
}
