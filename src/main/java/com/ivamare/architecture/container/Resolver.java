package com.ivamare.architecture.container;

import java.util.Optional;

/**
 * Read-only view of a container.
 */
public interface Resolver {

    /**
     * Resolve a capability to an instance, constructing dependencies recursively.
     *
     * @param capability The capability to resolve
     * @param <T> contract type
     * @return the instance, never null
     * @throws com.ivamare.architecture.exception.UnregisteredCapabilityException if nothing is bound
     * @throws com.ivamare.architecture.exception.CyclicDependencyException if resolution loops
     */
    <T> T resolve(Capability<T> capability);

    /**
     * Resolve the capability named after a type.
     *
     * @param type contract type
     * @param <T> contract type
     * @return the instance
     */
    default <T> T resolve(Class<T> type) {
        return resolve(Capability.of(type));
    }

    /**
     * Resolve if bound.
     *
     * @param capability The capability to resolve
     * @param <T> contract type
     * @return the instance, or empty if nothing is bound
     */
    default <T> Optional<T> resolveOptional(Capability<T> capability) {
        return isRegistered(capability) ? Optional.of(resolve(capability)) : Optional.empty();
    }

    /**
     * Check whether a capability is bound.
     *
     * @param capability The capability
     * @return true if a provider is registered
     */
    boolean isRegistered(Capability<?> capability);
}
