package com.ivamare.architecture.container;

/**
 * Factory for a capability's implementation.
 *
 * <p>Dependencies are pulled from the resolver in the order the provider asks
 * for them.
 *
 * @param <T> Contract type produced
 */
@FunctionalInterface
public interface Provider<T> {

    /**
     * Build an instance.
     *
     * @param resolver resolver for this provider's own dependencies
     * @return a new instance, never null
     * @throws Exception on construction failure
     */
    T provide(Resolver resolver) throws Exception;
}
