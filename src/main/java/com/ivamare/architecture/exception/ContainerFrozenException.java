package com.ivamare.architecture.exception;

/**
 * Thrown when a registration is attempted after the container has started.
 */
public class ContainerFrozenException extends ArchitectureException {

    public ContainerFrozenException(String capability) {
        super("Container already started, cannot register " + capability);
    }
}
