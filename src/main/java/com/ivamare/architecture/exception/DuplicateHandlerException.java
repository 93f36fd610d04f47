package com.ivamare.architecture.exception;

/**
 * Thrown when attempting to register a handler for a request type that already has one.
 */
public class DuplicateHandlerException extends ArchitectureException {

    private final Class<?> requestType;

    public DuplicateHandlerException(Class<?> requestType) {
        super("Handler already registered for " + requestType.getName());
        this.requestType = requestType;
    }

    public Class<?> getRequestType() {
        return requestType;
    }
}
