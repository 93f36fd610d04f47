package com.ivamare.architecture.container;

import java.util.function.Supplier;

/**
 * Holds instances of {@link Lifetime#SCOPED} capabilities for one scope.
 */
public interface ScopedInstanceStore {

    /**
     * Return the scope's instance for a capability, creating it on first use.
     *
     * @param capability The capability
     * @param factory Creates the instance when absent
     * @param <T> contract type
     * @return the scoped instance
     */
    <T> T scopedInstance(Capability<T> capability, Supplier<T> factory);
}
