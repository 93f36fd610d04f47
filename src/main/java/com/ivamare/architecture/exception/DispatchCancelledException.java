package com.ivamare.architecture.exception;

/**
 * Thrown when an in-flight dispatch is interrupted. Its unit of work has been rolled back.
 */
public class DispatchCancelledException extends ArchitectureException {

    public DispatchCancelledException(Class<?> requestType, Throwable cause) {
        super("Dispatch of " + requestType.getSimpleName() + " was cancelled", cause);
    }
}
