package com.ivamare.architecture.exception;

/**
 * Thrown when no handler is registered for a request type.
 */
public class HandlerNotFoundException extends ArchitectureException {

    private final Class<?> requestType;

    public HandlerNotFoundException(Class<?> requestType) {
        super("No handler registered for " + requestType.getName());
        this.requestType = requestType;
    }

    public Class<?> getRequestType() {
        return requestType;
    }
}
