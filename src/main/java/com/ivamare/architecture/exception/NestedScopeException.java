package com.ivamare.architecture.exception;

import java.util.UUID;

/**
 * Thrown when a unit of work is begun while another is active on the same thread.
 */
public class NestedScopeException extends ArchitectureException {

    private final UUID activeScopeId;

    public NestedScopeException(UUID activeScopeId) {
        super("Unit of work " + activeScopeId + " is already active on this thread");
        this.activeScopeId = activeScopeId;
    }

    public UUID getActiveScopeId() {
        return activeScopeId;
    }
}
