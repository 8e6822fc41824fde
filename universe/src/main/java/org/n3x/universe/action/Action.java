package org.n3x.universe.action;

/**
 * Provides an interface for executable actions run against a formed cluster. Actions can be either Tasks or Faults.
 * <p>
 * Task: a command that changes the state of the cluster nodes
 * Fault: a command that puts the cluster into a faulty state
 *
 * @param <R> action result
 */
public interface Action<R> {
    R execute();

    interface Task<R> extends Action<R> {

    }

    interface Fault<R> extends Action<R> {

    }
}
