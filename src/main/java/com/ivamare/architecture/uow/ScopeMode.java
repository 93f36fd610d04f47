package com.ivamare.architecture.uow;

/**
 * Whether a unit of work may register changes.
 */
public enum ScopeMode {
    READ_WRITE,
    READ_ONLY
}
