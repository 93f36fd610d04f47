package com.ivamare.architecture.exception;

/**
 * Thrown when a capability is resolved but no provider is bound to it.
 */
public class UnregisteredCapabilityException extends ArchitectureException {

    private final String capability;

    public UnregisteredCapabilityException(String capability) {
        super("No provider registered for capability " + capability);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
