package org.n3x.universe.scenario.fixture;

/**
 * Provides the input data of a scenario
 *
 * @param <T> data type
 */
@FunctionalInterface
public interface Fixture<T> {
    T data();
}
