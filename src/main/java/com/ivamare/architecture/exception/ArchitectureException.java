package com.ivamare.architecture.exception;

/**
 * Base exception for all architecture framework errors.
 */
public class ArchitectureException extends RuntimeException {

    public ArchitectureException(String message) {
        super(message);
    }

    public ArchitectureException(String message, Throwable cause) {
        super(message, cause);
    }
}
