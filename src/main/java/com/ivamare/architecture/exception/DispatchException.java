package com.ivamare.architecture.exception;

/**
 * Wraps a checked exception thrown by a request handler.
 */
public class DispatchException extends ArchitectureException {

    private final Class<?> requestType;

    public DispatchException(Class<?> requestType, Throwable cause) {
        super("Handler for " + requestType.getSimpleName() + " failed: " + cause.getMessage(), cause);
        this.requestType = requestType;
    }

    public Class<?> getRequestType() {
        return requestType;
    }
}
