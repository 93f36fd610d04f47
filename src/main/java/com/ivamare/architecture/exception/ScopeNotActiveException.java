package com.ivamare.architecture.exception;

/**
 * Thrown when an operation needs an active unit of work and none is bound.
 */
public class ScopeNotActiveException extends ArchitectureException {

    public ScopeNotActiveException(String message) {
        super(message);
    }
}
