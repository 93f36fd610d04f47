package com.ivamare.architecture.exception;

/**
 * Thrown when a change is registered in a read-only unit of work.
 */
public class ReadOnlyScopeException extends ArchitectureException {

    public ReadOnlyScopeException(String operation) {
        super("Cannot " + operation + " in a read-only unit of work");
    }
}
