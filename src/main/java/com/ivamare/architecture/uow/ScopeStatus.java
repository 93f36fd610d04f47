package com.ivamare.architecture.uow;

/**
 * Lifecycle of a unit of work.
 */
public enum ScopeStatus {
    ACTIVE,
    COMMITTED,
    ROLLED_BACK;

    public boolean isEnded() {
        return this != ACTIVE;
    }
}
