package com.ivamare.architecture.exception;

import java.util.List;

/**
 * Thrown when resolving a capability revisits one that is still being constructed.
 */
public class CyclicDependencyException extends ArchitectureException {

    private final List<String> path;

    public CyclicDependencyException(List<String> path) {
        super("Cyclic dependency detected: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /**
     * The resolution path, starting and ending with the repeated capability.
     *
     * @return capability names in resolution order
     */
    public List<String> getPath() {
        return path;
    }
}
