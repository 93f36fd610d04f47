package com.ivamare.architecture.exception;

/**
 * Thrown when a capability is bound twice in the same container.
 */
public class DuplicateRegistrationException extends ArchitectureException {

    private final String capability;

    public DuplicateRegistrationException(String capability) {
        super("Capability already registered: " + capability);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
