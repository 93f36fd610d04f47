package com.ivamare.architecture.exception;

/**
 * Thrown when an entity snapshot or request payload cannot be encoded or decoded.
 */
public class SerializationException extends ArchitectureException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
