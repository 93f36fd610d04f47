package com.ivamare.architecture.container;

/**
 * An immutable binding from a capability to its provider.
 *
 * @param capability The bound capability
 * @param provider Construction strategy
 * @param lifetime Reuse policy
 * @param <T> Contract type
 */
public record Registration<T>(
    Capability<T> capability,
    Provider<T> provider,
    Lifetime lifetime
) {
    public Registration {
        if (capability == null) {
            throw new IllegalArgumentException("capability is required");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        if (lifetime == null) {
            lifetime = Lifetime.TRANSIENT;
        }
    }
}
