package com.ivamare.architecture.exception;

import java.util.List;

/**
 * Raised by validation middleware before the handler runs.
 *
 * <p>No unit of work change has happened when this is thrown.
 */
public class ValidationException extends ArchitectureException {

    private final Class<?> requestType;
    private final List<String> violations;

    public ValidationException(Class<?> requestType, List<String> violations) {
        super("Validation failed for " + requestType.getSimpleName() + ": " + String.join("; ", violations));
        this.requestType = requestType;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public Class<?> getRequestType() {
        return requestType;
    }

    public List<String> getViolations() {
        return violations;
    }
}
