package com.ivamare.architecture.exception;

/**
 * Thrown when a second instance is tracked for an identity that is already tracked.
 */
public class IdentityConflictException extends ArchitectureException {

    private final Object key;

    public IdentityConflictException(Object key) {
        super("A different instance is already tracked for " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
