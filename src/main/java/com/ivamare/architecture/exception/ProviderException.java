package com.ivamare.architecture.exception;

/**
 * Thrown when a provider fails or produces no instance.
 */
public class ProviderException extends ArchitectureException {

    private final String capability;

    public ProviderException(String capability, String message) {
        super("Provider for " + capability + " failed: " + message);
        this.capability = capability;
    }

    public ProviderException(String capability, Throwable cause) {
        super("Provider for " + capability + " failed: " + cause.getMessage(), cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
