package com.ivamare.architecture.container;

import java.util.Optional;

/**
 * Locates the scope bound to the calling execution context.
 */
@FunctionalInterface
public interface ScopeAccessor {

    ScopeAccessor NONE = Optional::empty;

    Optional<ScopedInstanceStore> currentStore();
}
