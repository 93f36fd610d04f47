package com.ivamare.architecture.exception;

import java.util.UUID;

/**
 * Thrown when a unit of work is used after commit or rollback.
 */
public class ScopeClosedException extends ArchitectureException {

    public ScopeClosedException(UUID scopeId, String status) {
        super("Unit of work " + scopeId + " is already " + status);
    }
}
