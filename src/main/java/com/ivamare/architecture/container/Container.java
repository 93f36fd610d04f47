package com.ivamare.architecture.container;

import java.util.List;

/**
 * Registry of capability bindings.
 *
 * <p>Bindings are added during startup and become read-only once
 * {@link #start()} has been called.
 */
public interface Container extends Resolver {

    /**
     * Bind a capability to a provider.
     *
     * @param capability The capability
     * @param provider Construction strategy
     * @param lifetime Reuse policy
     * @param <T> contract type
     * @throws com.ivamare.architecture.exception.DuplicateRegistrationException if already bound
     * @throws com.ivamare.architecture.exception.ContainerFrozenException if the container has started
     */
    <T> void register(Capability<T> capability, Provider<T> provider, Lifetime lifetime);

    /**
     * Bind a capability to an existing instance as a singleton.
     *
     * @param capability The capability
     * @param instance The instance
     * @param <T> contract type
     */
    default <T> void registerInstance(Capability<T> capability, T instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance is required");
        }
        register(capability, resolver -> instance, Lifetime.SINGLETON);
    }

    /**
     * Freeze registrations. Idempotent.
     */
    void start();

    /**
     * @return true once {@link #start()} has been called
     */
    boolean isStarted();

    /**
     * @return all bindings in registration order
     */
    List<Registration<?>> registrations();
}
