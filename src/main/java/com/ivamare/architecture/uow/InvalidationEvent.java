package com.ivamare.architecture.uow;

import java.util.Set;
import java.util.UUID;

/**
 * Published after a unit of work commits.
 *
 * @param scopeId The committed unit of work
 * @param entityTypes Entity types that were inserted, updated or deleted
 */
public record InvalidationEvent(UUID scopeId, Set<Class<?>> entityTypes) {

    public InvalidationEvent {
        entityTypes = entityTypes == null ? Set.of() : Set.copyOf(entityTypes);
    }
}
